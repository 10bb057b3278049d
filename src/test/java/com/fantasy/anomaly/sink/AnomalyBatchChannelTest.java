package com.fantasy.anomaly.sink;

import com.fantasy.anomaly.config.MonitorProperties;
import com.fantasy.anomaly.model.AnomalyBatch;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Duration;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AnomalyBatchChannelTest {

    @Mock
    private ObjectProvider<AlertSink> sinkBeans;

    @Mock
    private AlertSink downstream;

    private AnomalyBatchChannel channel;

    @BeforeEach
    void setUp() {
        MonitorProperties properties = new MonitorProperties();
        properties.setChannelCapacity(2);
        channel = new AnomalyBatchChannel(properties, sinkBeans);
    }

    @AfterEach
    void tearDown() {
        channel.stopDispatcher();
    }

    @Test
    void publish_batchesPolledInOrder() throws Exception {
        channel.publish(batch(1));
        channel.publish(batch(2));

        assertThat(channel.size()).isEqualTo(2);
        assertThat(channel.poll(Duration.ofMillis(100))).hasValueSatisfying(b -> assertThat(b.getCycleId()).isEqualTo(1));
        assertThat(channel.poll(Duration.ofMillis(100))).hasValueSatisfying(b -> assertThat(b.getCycleId()).isEqualTo(2));
        assertThat(channel.poll(Duration.ofMillis(10))).isEmpty();
    }

    @Test
    void deliver_failingSink_doesNotBlockOthers() {
        AlertSink failing = mock(AlertSink.class);
        doThrow(new IllegalStateException("sms gateway down")).when(failing).publish(any());
        channel.subscribe(failing);
        channel.subscribe(downstream);

        AnomalyBatch batch = batch(7);
        channel.deliver(batch);

        verify(failing).publish(batch);
        verify(downstream).publish(batch);
    }

    @Test
    void startDispatcher_forwardsToOtherSinks() {
        when(sinkBeans.orderedStream()).thenReturn(Stream.of(channel, downstream));
        channel.startDispatcher();

        AnomalyBatch batch = batch(3);
        channel.publish(batch);

        verify(downstream, timeout(2000)).publish(batch);
        assertThat(channel.size()).isZero();
    }

    private static AnomalyBatch batch(long cycleId) {
        return AnomalyBatch.builder()
                .cycleId(cycleId)
                .startedAt(1_760_860_800_000L)
                .completedAt(1_760_860_801_000L)
                .build();
    }
}
