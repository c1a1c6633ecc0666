package com.baselinesentinel.runner;

import com.baselinesentinel.core.spi.NotificationException;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link KafkaReportSink} using Kafka's {@link MockProducer}.
 */
class KafkaReportSinkTest {

    @Test
    @DisplayName("Should send the report as JSON keyed by the current window end")
    void publishes() {
        MockProducer<String, String> producer =
                new MockProducer<>(true, new StringSerializer(), new StringSerializer());
        KafkaReportSink sink = new KafkaReportSink(producer, "anomaly-reports");

        sink.publish(Reports.sample());

        assertThat(producer.history()).hasSize(1);
        ProducerRecord<String, String> record = producer.history().get(0);
        assertThat(record.topic()).isEqualTo("anomaly-reports");
        assertThat(record.key()).isEqualTo("2024-01-15T07:00:00Z");
        assertThat(record.value()).contains("\"BASELINE_GROWTH\"").contains("\"redis-001\"");
    }

    @Test
    @DisplayName("Should surface a broker failure as NotificationException")
    void failure() {
        MockProducer<String, String> producer =
                new MockProducer<>(true, new StringSerializer(), new StringSerializer());
        producer.sendException = new KafkaException("broker down");
        KafkaReportSink sink = new KafkaReportSink(producer, "anomaly-reports");

        assertThatThrownBy(() -> sink.publish(Reports.sample()))
                .isInstanceOf(NotificationException.class)
                .hasMessageContaining("anomaly-reports");
    }
}
