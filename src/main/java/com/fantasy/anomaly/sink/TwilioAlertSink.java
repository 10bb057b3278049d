package com.fantasy.anomaly.sink;

import com.fantasy.anomaly.config.MetricsConfig;
import com.fantasy.anomaly.config.TwilioNotificationConfig;
import com.fantasy.anomaly.model.Anomaly;
import com.fantasy.anomaly.model.AnomalyBatch;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Sends one SMS (or WhatsApp) message per anomaly at or above the configured
 * minimum severity.
 */
@Component
public class TwilioAlertSink implements AlertSink {

    private static final Logger log = LoggerFactory.getLogger(TwilioAlertSink.class);

    private final TwilioNotificationConfig config;
    private final MetricsConfig metricsConfig;

    public TwilioAlertSink(TwilioNotificationConfig config, MetricsConfig metricsConfig) {
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Twilio alert sink initialized. Channel: {}, min severity: {}",
                    config.getChannel(), config.getMinSeverity());
        } else {
            log.info("Twilio alert sink is DISABLED.");
        }
    }

    @Override
    @Observed(name = "notification.send", contextualName = "send-anomaly-notifications")
    public void publish(AnomalyBatch batch) {
        if (!config.isEnabled()) {
            return;
        }
        for (Anomaly anomaly : batch.getAnomalies()) {
            if (anomaly.getSeverity().isAtLeast(config.getMinSeverity())) {
                send(anomaly);
            }
        }
    }

    void send(Anomaly anomaly) {
        try {
            String from = resolveNumber(config.getFromNumber());
            String to = resolveNumber(config.getToNumber());

            Message message = Message.creator(
                    new PhoneNumber(to),
                    new PhoneNumber(from),
                    buildMessageBody(anomaly)
            ).create();

            metricsConfig.recordNotification(config.getChannel(), "success");
            log.info("Twilio notification sent for anomaly={}, sid={}", anomaly.getId(), message.getSid());
        } catch (Exception e) {
            metricsConfig.recordNotification(config.getChannel(), "error");
            log.error("Failed to send Twilio notification for anomaly={}: {}", anomaly.getId(), e.getMessage(), e);
        }
    }

    static String buildMessageBody(Anomaly anomaly) {
        return String.format(
                "[ANOMALY ALERT] %s %s\n" +
                "Player: %s\n" +
                "%s: %.2f (expected %.2f)\n" +
                "Action: %s (%s)",
                anomaly.getSeverity().getValue().toUpperCase(),
                anomaly.getType().getValue(),
                anomaly.getSubjectName() != null ? anomaly.getSubjectName() : anomaly.getSubjectId(),
                anomaly.getDetails().getMetric(),
                anomaly.getDetails().getActualValue(),
                anomaly.getDetails().getExpectedValue(),
                anomaly.getImpact().getRecommendedAction().getValue(),
                anomaly.getImpact().getUrgency().getValue()
        );
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
