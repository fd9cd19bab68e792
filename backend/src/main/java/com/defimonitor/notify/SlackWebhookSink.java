package com.defimonitor.notify;

import com.defimonitor.config.AppProps;
import com.defimonitor.exception.NotificationException;
import com.defimonitor.model.ProtocolAlert;
import com.defimonitor.model.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.*;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Posts alerts to a Slack incoming webhook as a coloured attachment.
 * Disabled (every send returns false) when {@code app.slack.webhook-url} is blank.
 */
@Component
@Slf4j
public class SlackWebhookSink implements NotificationSink {

    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'", Locale.ROOT).withZone(ZoneOffset.UTC);

    private final RestTemplate webhookRestTemplate;
    private final AppProps.Slack slack;

    public SlackWebhookSink(@Qualifier("webhookRestTemplate") RestTemplate webhookRestTemplate, AppProps props) {
        this.webhookRestTemplate = webhookRestTemplate;
        this.slack = props.getSlack();
        if (slack.isEnabled()) {
            log.info("Slack notifications enabled");
        } else {
            log.info("Slack notifications disabled (no webhook URL configured)");
        }
    }

    @Override
    public boolean send(ProtocolAlert alert) {
        if (!slack.isEnabled()) {
            log.debug("Slack notifications disabled, skipping alert for {}", alert.getProtocolId());
            return false;
        }
        try {
            post(formatAlert(alert));
            log.info("Sent Slack notification for {} - {}", alert.getProtocolId(), alert.getKind().getCode());
            return true;
        } catch (Exception e) {
            log.error("Failed to send Slack notification for {} - {}: {}",
                    alert.getProtocolId(), alert.getKind().getCode(), e.getMessage());
            return false;
        }
    }

    /** Sends a fixed message to check the webhook wiring. */
    public boolean sendTestMessage() {
        if (!slack.isEnabled()) {
            log.warn("Cannot send test message: Slack webhook not configured");
            return false;
        }
        Map<String, Object> message = Map.of(
                "text", "✅ DeFi Monitor - Slack Integration Test",
                "blocks", List.of(Map.of(
                        "type", "section",
                        "text", mrkdwn("Slack integration is working correctly! You will receive alerts here when anomalies are detected."))));
        try {
            post(message);
            log.info("Test message sent successfully");
            return true;
        } catch (Exception e) {
            log.error("Failed to send test message: {}", e.getMessage());
            return false;
        }
    }

    Map<String, Object> formatAlert(ProtocolAlert alert) {
        Severity severity = alert.getSeverity();
        String level = severity.getCode().toUpperCase(Locale.ROOT);
        String protocol = alert.getProtocolId();

        Map<String, Object> header = Map.of(
                "type", "header",
                "text", Map.of(
                        "type", "plain_text",
                        "text", severity.getEmoji() + " " + level + " Alert: " + protocol,
                        "emoji", true));
        Map<String, Object> fields = Map.of(
                "type", "section",
                "fields", List.of(
                        mrkdwn("*Protocol:*\n" + protocol),
                        mrkdwn("*Severity:*\n" + level),
                        mrkdwn("*Alert Type:*\n" + alert.getKind().getCode()),
                        mrkdwn("*Time:*\n" + TIME_FORMAT.format(alert.getTriggeredAt()))));
        Map<String, Object> details = Map.of(
                "type", "section",
                "text", mrkdwn("*Details:*\n" + alert.getMessage()));

        return Map.of("attachments", List.of(Map.of(
                "color", severity.getColor(),
                "blocks", List.of(header, fields, details))));
    }

    private void post(Map<String, Object> payload) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<Map<String, Object>> req = new HttpEntity<>(payload, headers);
        try {
            ResponseEntity<String> resp = webhookRestTemplate.exchange(slack.getWebhookUrl(), HttpMethod.POST, req, String.class);
            if (resp.getStatusCode().value() != 200) {
                throw new NotificationException("Slack HTTP " + resp.getStatusCode().value() + " - " + resp.getBody());
            }
        } catch (HttpStatusCodeException httpEx) {
            throw new NotificationException("Slack HTTP " + httpEx.getStatusCode().value() + " - " + httpEx.getResponseBodyAsString(), httpEx);
        } catch (RestClientException e) {
            throw new NotificationException("Slack call failed: " + e.getMessage(), e);
        }
    }

    private static Map<String, Object> mrkdwn(String text) {
        return Map.of("type", "mrkdwn", "text", text);
    }
}
