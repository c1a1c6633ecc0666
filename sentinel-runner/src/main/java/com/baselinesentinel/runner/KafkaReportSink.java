package com.baselinesentinel.runner;

import com.baselinesentinel.core.model.AnomalyReport;
import com.baselinesentinel.core.spi.NotificationException;
import com.baselinesentinel.core.spi.NotificationSink;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link NotificationSink} that publishes each report as one JSON message.
 *
 * <p>
 * The record key is the end of the current window, so every report of the
 * same window lands on the same partition. Publishing waits for the broker
 * acknowledgement.
 * </p>
 */
public final class KafkaReportSink implements NotificationSink, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(KafkaReportSink.class);

    private static final Duration SEND_TIMEOUT = Duration.ofSeconds(30);

    private final Producer<String, String> producer;
    private final String topic;

    public KafkaReportSink(Producer<String, String> producer, String topic) {
        this.producer = Objects.requireNonNull(producer, "Producer must not be null");
        this.topic = Objects.requireNonNull(topic, "Topic must not be null");
    }

    public static KafkaReportSink from(RunnerConfig config) {
        return new KafkaReportSink(new KafkaProducer<>(config.kafkaProducerProperties()),
                config.getKafkaReportTopic());
    }

    @Override
    public void publish(AnomalyReport report) {
        String key = report.getWindow().getCurrent().getEnd().toString();
        ProducerRecord<String, String> record = new ProducerRecord<>(topic, key, ReportSerializer.toJson(report));
        try {
            RecordMetadata metadata = producer.send(record).get(SEND_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            LOG.info("Published anomaly report key={} to {}-{}@{}",
                    key, metadata.topic(), metadata.partition(), metadata.offset());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NotificationException("Interrupted while publishing report to " + topic, e);
        } catch (ExecutionException e) {
            throw new NotificationException("Failed to publish report to " + topic, e.getCause());
        } catch (TimeoutException e) {
            throw new NotificationException("Timed out publishing report to " + topic, e);
        } catch (KafkaException e) {
            throw new NotificationException("Failed to publish report to " + topic, e);
        }
    }

    @Override
    public void close() {
        producer.close(Duration.ofSeconds(5));
    }
}
