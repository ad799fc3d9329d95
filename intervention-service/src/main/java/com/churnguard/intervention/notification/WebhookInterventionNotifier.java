package com.churnguard.intervention.notification;

import com.churnguard.common.model.InterventionAction;
import com.churnguard.common.model.InterventionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Renders the per-tier retention message and posts it to a webhook as {@code {"text": ...}}.
 * With the webhook disabled or unconfigured the rendered message is only logged.
 */
@Component
public class WebhookInterventionNotifier implements InterventionNotifier {

    private static final Logger log = LoggerFactory.getLogger(WebhookInterventionNotifier.class);

    private final WebClient webClient;
    private final boolean enabled;
    private final String webhookUrl;

    public WebhookInterventionNotifier(WebClient.Builder builder,
                                       @Value("${notification.webhook.enabled:false}") boolean enabled,
                                       @Value("${notification.webhook.url:}") String webhookUrl) {
        this.webClient  = builder.build();
        this.enabled    = enabled;
        this.webhookUrl = webhookUrl == null ? "" : webhookUrl;
    }

    @Override
    public void notify(InterventionRecord intervention) {
        String message = buildMessage(intervention);

        if (!enabled || webhookUrl.isBlank()) {
            log.info("Webhook disabled or no URL configured. Logging notification instead. userId={} action={} message={}",
                     intervention.userId(), intervention.actionType().dbValue(), message);
            return;
        }

        // a malformed URL fails inside uri(), so build the request lazily
        Mono.defer(() -> webClient.post()
                .uri(webhookUrl)
                .bodyValue(Map.of("text", message))
                .retrieve()
                .toBodilessEntity())
            .subscribe(
                r -> log.info("Intervention notification sent. interventionId={} userId={} status={}",
                              intervention.id(), intervention.userId(), r.getStatusCode()),
                e -> log.error("Intervention notification failed. interventionId={} userId={}",
                               intervention.id(), intervention.userId(), e)
            );
    }

    static String buildMessage(InterventionRecord intervention) {
        String recipient = recipientFor(intervention.userId());
        return String.format("*%s* → %s%n%s", subject(intervention.actionType()), recipient,
                             body(intervention.actionType()));
    }

    static String recipientFor(String userId) {
        return userId + "@example.com";
    }

    private static String subject(InterventionAction action) {
        return switch (action) {
            case NUDGE   -> "We miss you! Here's what you've been missing";
            case SUPPORT -> "Need help? Our support team is here for you";
            case OFFER   -> "A special offer just for you!";
        };
    }

    private static String body(InterventionAction action) {
        return switch (action) {
            case NUDGE   -> "It's been a while since your last visit. New features are waiting for you.";
            case SUPPORT -> "Our dedicated support team has been alerted and will reach out within 24 hours.";
            case OFFER   -> "Enjoy 20% OFF your next renewal. Code: STAY20. This offer expires in 7 days.";
        };
    }
}
