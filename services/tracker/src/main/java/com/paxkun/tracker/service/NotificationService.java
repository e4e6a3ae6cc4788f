package com.paxkun.tracker.service;

import com.google.gson.Gson;
import com.paxkun.tracker.service.tracking.NewChapterNotice;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Delivers new-chapter notifications to a Discord webhook.
 * <p>
 * Delivery is best effort: every failure is logged and reported as {@code false}, never thrown.
 * <p>
 * Author: Pax
 */
@Service
public class NotificationService {

    private static final String TAG = "NOTIFY";
    static final int MAX_EMBEDS = 10;
    static final int EMBED_COLOR = 0x00ff00;
    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final WebClient webClient = WebClient.builder().build();
    private final Gson gson = new Gson();
    private final LoggerService logger;

    @Value("${tracker.notifications.type:discord}")
    private String notificationType;

    @Value("${tracker.notifications.discord-webhook-url:}")
    private String webhookUrl;

    public NotificationService(LoggerService logger) {
        this.logger = logger;
    }

    /**
     * @return true when the webhook accepted the message
     */
    public boolean notifyNewChapters(List<NewChapterNotice> chapters) {
        if (chapters == null || chapters.isEmpty()) {
            logger.debug(TAG, "No new chapters to notify");
            return false;
        }

        String type = notificationType == null ? "" : notificationType.trim().toLowerCase(Locale.ROOT);
        if (!"discord".equals(type)) {
            logger.info(TAG, "Notifications disabled (type=" + LoggerService.sanitizeForLog(notificationType) + ")");
            return false;
        }
        if (webhookUrl == null || webhookUrl.isBlank()) {
            logger.warn(TAG, "⚠️ Discord webhook URL not configured, skipping notification for "
                    + chapters.size() + " chapter(s)");
            return false;
        }

        String payload = gson.toJson(buildPayload(chapters));
        try {
            webClient.post()
                    .uri(webhookUrl)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(payload)
                    .retrieve()
                    .toBodilessEntity()
                    .block(TIMEOUT);
            logger.info(TAG, "✅ Sent Discord notification for " + chapters.size() + " new chapter(s)");
            return true;
        } catch (Exception e) {
            logger.error(TAG, "❌ Failed to send Discord notification", e);
            return false;
        }
    }

    /**
     * Sends one synthetic chapter to check the webhook configuration.
     */
    public boolean sendTestNotification() {
        NewChapterNotice sample = new NewChapterNotice(
                "Test Manga",
                "1",
                "This is a test notification",
                "https://example.com/test-manga/chapter-1",
                "Test Scanlator",
                LocalDateTime.now(ZoneOffset.UTC));
        return notifyNewChapters(List.of(sample));
    }

    Map<String, Object> buildPayload(List<NewChapterNotice> chapters) {
        List<Map<String, Object>> embeds = new ArrayList<>();
        for (NewChapterNotice chapter : chapters.subList(0, Math.min(MAX_EMBEDS, chapters.size()))) {
            embeds.add(chapterEmbed(chapter));
        }

        if (chapters.size() > MAX_EMBEDS) {
            Map<String, Object> more = new LinkedHashMap<>();
            more.put("title", "📚 And more...");
            more.put("description", (chapters.size() - MAX_EMBEDS) + " more new chapter(s) detected");
            more.put("color", EMBED_COLOR);
            embeds.add(more);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("content", "🆕 **" + chapters.size() + " new chapter(s) detected!**");
        payload.put("embeds", embeds);
        return payload;
    }

    private Map<String, Object> chapterEmbed(NewChapterNotice chapter) {
        Map<String, Object> embed = new LinkedHashMap<>();
        embed.put("title", chapter.workTitle() + " - Chapter " + chapter.chapterNumber());
        embed.put("url", chapter.url());
        String description = chapter.chapterTitle();
        embed.put("description", description == null || description.isBlank() ? "New chapter available" : description);
        embed.put("color", EMBED_COLOR);
        if (chapter.detectedAt() != null) {
            embed.put("timestamp", chapter.detectedAt().atOffset(ZoneOffset.UTC).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME));
        }
        embed.put("footer", Map.of("text", "Scanlator: " + chapter.sourceName()));
        return embed;
    }
}
