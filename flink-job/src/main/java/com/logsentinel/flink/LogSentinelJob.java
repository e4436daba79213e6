package com.logsentinel.flink;

import com.logsentinel.core.model.AlertRecord;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.CheckpointConfig;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Main entry point for the Log Sentinel Flink job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (raw log lines)
 *     → decode UTF-8, drop blank lines
 *     → ClassificationProcessFunction (parse, classify, calibrate, store)
 *     → Serialize AlertRecord → JSON
 *     → Kafka (alerts topic)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Deployment settings come from environment variables via {@link JobConfig};
 * pipeline tunables from the YAML file named by {@code PIPELINE_CONFIG_PATH}.
 * </p>
 *
 * <h3>Parallelism</h3>
 * <p>
 * The job runs with parallelism 1: the operating threshold and score window
 * are owned by a single worker.
 * </p>
 *
 * @since 1.0.0
 */
public final class LogSentinelJob {

        private static final Logger LOG = LoggerFactory.getLogger(LogSentinelJob.class);

        private LogSentinelJob() {
                // entry-point class, not instantiable
        }

        public static void main(String[] args) throws Exception {
                // 1. Load configuration
                JobConfig config = JobConfig.fromEnvironment();
                LOG.info("Starting Log Sentinel with config: {}", config);

                // 2. Set up Flink execution environment
                StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
                env.setParallelism(1);
                // alert records go to the sink without a copy
                env.getConfig().enableObjectReuse();
                configureCheckpointing(env, config);

                // 3. Build pipeline
                buildPipeline(env, config);

                // 4. Execute
                env.execute("Log Sentinel - Log Classification");
        }

        // ---------------------------------------------------------------
        // Pipeline assembly
        // ---------------------------------------------------------------

        /**
         * Build the Kafka → Flink → Kafka pipeline.
         */
        static void buildPipeline(StreamExecutionEnvironment env, JobConfig config) {
                KafkaSource<String> kafkaSource = KafkaSource.<String>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setTopics(config.getKafkaInputTopic())
                                .setGroupId(config.getKafkaGroupId())
                                .setProperties(config.kafkaConsumerProperties())
                                .setStartingOffsets(OffsetsInitializer.earliest())
                                .setValueOnlyDeserializer(new LogLineDeserializationSchema())
                                .build();

                DataStream<String> lines = env.fromSource(
                                kafkaSource, WatermarkStrategy.noWatermarks(), "kafka-raw-logs-source");

                DataStream<AlertRecord> alerts = lines
                                .filter(Objects::nonNull) // blank lines decode to null
                                .name("drop-blank-lines")
                                .process(new ClassificationProcessFunction(config))
                                .setParallelism(1)
                                .name("log-classification");

                KafkaSink<AlertRecord> kafkaSink = KafkaSink.<AlertRecord>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setKafkaProducerConfig(config.kafkaProducerProperties())
                                .setRecordSerializer(
                                                KafkaRecordSerializationSchema.builder()
                                                                .setTopic(config.getKafkaAlertTopic())
                                                                .setValueSerializationSchema(
                                                                                new AlertRecordSerializationSchema())
                                                                .build())
                                .build();

                alerts.sinkTo(kafkaSink).name("kafka-alerts-sink");
        }

        // ---------------------------------------------------------------
        // Helpers
        // ---------------------------------------------------------------

        private static void configureCheckpointing(StreamExecutionEnvironment env, JobConfig config) {
                long interval = config.getCheckpointIntervalMs();
                env.enableCheckpointing(interval, CheckpointingMode.EXACTLY_ONCE);

                CheckpointConfig cpConfig = env.getCheckpointConfig();
                cpConfig.setMinPauseBetweenCheckpoints(interval / 2);
                cpConfig.setCheckpointTimeout(interval * 2);
                cpConfig.setMaxConcurrentCheckpoints(1);
                cpConfig.setExternalizedCheckpointCleanup(
                                CheckpointConfig.ExternalizedCheckpointCleanup.RETAIN_ON_CANCELLATION);
        }
}
