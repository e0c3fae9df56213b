package br.com.analytics.pipeline.pvm_bridge_batch.config;

import br.com.analytics.pipeline.pvm_bridge_batch.bridge.BridgeCalculator;
import br.com.analytics.pipeline.pvm_bridge_batch.listener.StopSignalListener;
import br.com.analytics.pipeline.pvm_bridge_batch.model.BridgeOptions;
import br.com.analytics.pipeline.pvm_bridge_batch.model.RawRecord;
import br.com.analytics.pipeline.pvm_bridge_batch.processor.AggregationProcessor;
import br.com.analytics.pipeline.pvm_bridge_batch.reader.CancellationFlag;
import br.com.analytics.pipeline.pvm_bridge_batch.reader.ChunkedDelimitedItemReader;
import br.com.analytics.pipeline.pvm_bridge_batch.reader.ColumnMappingDetector;
import br.com.analytics.pipeline.pvm_bridge_batch.reader.DatasetPreview;
import br.com.analytics.pipeline.pvm_bridge_batch.reader.DatasetScanner;
import br.com.analytics.pipeline.pvm_bridge_batch.tasklet.BridgeCalculationTasklet;
import br.com.analytics.pipeline.pvm_bridge_batch.writer.BridgeResultSink;
import br.com.analytics.pipeline.pvm_bridge_batch.writer.LoggingBridgeResultSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.job.Job;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.job.parameters.RunIdIncrementer;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.Step;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.batch.infrastructure.item.ItemWriter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.util.List;

@Configuration
public class PvmBridgeBatchConfig {

    private static final Logger log = LoggerFactory.getLogger(PvmBridgeBatchConfig.class);

    private final JobRepository jobRepository;
    private final BridgeProperties properties;

    public PvmBridgeBatchConfig(JobRepository jobRepository, BridgeProperties properties) {
        this.jobRepository = jobRepository;
        this.properties = properties;
    }

    @Bean
    public CancellationFlag cancellationFlag() {
        return new CancellationFlag();
    }

    @Bean
    public Resource inputResource(ResourceLoader resourceLoader) {
        String location = properties.input().location();
        if (location == null || location.isBlank()) {
            throw new ConfigurationException("Missing input location: pvm.bridge.input.location");
        }
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new ConfigurationException("Input not found: " + location);
        }
        return resource;
    }

    @Bean
    public ReaderSettings readerSettings() {
        return BridgeSettingsFactory.readerSettings(properties.input());
    }

    @Bean
    public AggregationSettings aggregationSettings(Resource inputResource, ReaderSettings readerSettings) {
        return BridgeSettingsFactory.aggregationSettings(properties, () -> dateSamples(inputResource, readerSettings));
    }

    @Bean
    public BridgeOptions bridgeOptions() {
        return BridgeSettingsFactory.bridgeOptions(properties);
    }

    @Bean
    public ChunkedDelimitedItemReader itemReader(Resource inputResource, ReaderSettings readerSettings,
                                                 CancellationFlag cancellationFlag) {
        return new ChunkedDelimitedItemReader(inputResource, readerSettings, cancellationFlag,
                (bytesRead, totalBytes, rowsRead) -> log.debug("Read {} rows, {}/{} bytes", rowsRead, bytesRead, totalBytes));
    }

    @Bean
    public AggregationProcessor itemProcessor(AggregationSettings aggregationSettings) {
        return new AggregationProcessor(aggregationSettings);
    }

    @Bean
    public ItemWriter<RawRecord> itemWriter() {
        return items -> log.debug("Chunk of {} records passed aggregation", items.size());
    }

    @Bean
    public BridgeCalculator bridgeCalculator(BridgeOptions bridgeOptions) {
        return new BridgeCalculator(bridgeOptions);
    }

    @Bean
    public BridgeResultSink bridgeResultSink() {
        return new LoggingBridgeResultSink();
    }

    @Bean
    public BridgeCalculationTasklet bridgeCalculationTasklet(AggregationProcessor itemProcessor,
                                                             BridgeCalculator bridgeCalculator,
                                                             BridgeResultSink bridgeResultSink,
                                                             CancellationFlag cancellationFlag) {
        return new BridgeCalculationTasklet(itemProcessor, bridgeCalculator, bridgeResultSink, cancellationFlag);
    }

    @Bean
    public Step aggregationStep(
            ChunkedDelimitedItemReader reader,
            AggregationProcessor processor,
            ItemWriter<RawRecord> writer,
            CancellationFlag cancellationFlag
    ) {
        return new StepBuilder("aggregationStep", jobRepository)
                .<RawRecord, RawRecord>chunk(500)
                .reader(reader)
                .processor(processor)
                .writer(writer)
                .listener(new StopSignalListener(cancellationFlag))
                .build();
    }

    @Bean
    public Step bridgeStep(BridgeCalculationTasklet tasklet) {
        return new StepBuilder("bridgeStep", jobRepository)
                .tasklet(tasklet)
                .build();
    }

    @Bean
    public Job pvmBridgeJob(Step aggregationStep, Step bridgeStep) {
        return new JobBuilder("pvmBridgeJob", jobRepository)
                .incrementer(new RunIdIncrementer())
                .start(aggregationStep)
                .next(bridgeStep)
                .build();
    }

    private List<String> dateSamples(Resource resource, ReaderSettings readerSettings) {
        try {
            DatasetPreview preview = DatasetScanner.scan(resource, readerSettings, DatasetScanner.DEFAULT_SAMPLE_ROWS);
            return ColumnMappingDetector.dateSamples(preview.sampleRows(), properties.columns().date(),
                    DatasetScanner.DEFAULT_SAMPLE_ROWS);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to sample " + resource.getDescription() + " for date format detection", e);
        }
    }
}
