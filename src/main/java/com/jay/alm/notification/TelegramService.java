package com.jay.alm.notification;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jay.alm.config.AlmConfig;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Telegram Bot API client used for run alerts.
 * Posts to sendMessage with OkHttp; no Telegram SDK dependency.
 * Silently skips sending when the bot token or chat id is not configured.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TelegramService {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final int MAX_MESSAGE_LENGTH = 4000;   // Telegram rejects > 4096 chars

    private final AlmConfig config;
    private final ObjectMapper mapper = new ObjectMapper();
    private OkHttpClient httpClient;

    @PostConstruct
    public void init() {
        this.httpClient = new OkHttpClient.Builder()
            .connectTimeout(10, TimeUnit.SECONDS)
            .readTimeout(15, TimeUnit.SECONDS)
            .build();
        log.info("TelegramService initialized. Bot configured: {}", isConfigured());
    }

    public boolean isConfigured() {
        String token = config.telegram().getBotToken();
        String chatId = config.telegram().getChatId();
        return token != null && !token.isBlank() && chatId != null && !chatId.isBlank();
    }

    // ── Sending Messages ───────────────────────────────────────────────────────

    public boolean sendMessage(String text) {
        if (!isConfigured()) {
            log.debug("Telegram not configured — message not sent");
            return false;
        }
        String body = text.length() > MAX_MESSAGE_LENGTH ? text.substring(0, MAX_MESSAGE_LENGTH) + "…" : text;
        try {
            String payload = mapper.createObjectNode()
                .put("chat_id", config.telegram().getChatId())
                .put("text", body)
                .put("parse_mode", "HTML")
                .toString();

            Request request = new Request.Builder()
                .url(endpoint("sendMessage"))
                .post(RequestBody.create(payload, JSON))
                .build();

            try (Response response = httpClient.newCall(request).execute()) {
                if (response.isSuccessful()) {
                    log.debug("Telegram message sent successfully");
                    return true;
                }
                log.error("Telegram sendMessage failed: {} — {}",
                    response.code(), response.body() != null ? response.body().string() : "");
                return false;
            }
        } catch (IOException e) {
            log.error("Telegram sendMessage exception: {}", e.getMessage());
            return false;
        }
    }

    /** Sends an alert: bold title, then the body. HTML special characters in both are escaped. */
    public boolean sendAlert(String title, String body) {
        return sendMessage(String.format("<b>%s</b>%n%s", escape(title), escape(body)));
    }

    /** Tests if the Telegram bot is reachable and configured */
    public boolean testConnection() {
        if (!isConfigured()) return false;
        Request request = new Request.Builder().url(endpoint("getMe")).get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            return response.isSuccessful();
        } catch (IOException e) {
            log.debug("Telegram getMe failed: {}", e.getMessage());
            return false;
        }
    }

    private String endpoint(String method) {
        return config.telegram().getApiBase() + config.telegram().getBotToken() + "/" + method;
    }

    private static String escape(String text) {
        if (text == null) return "";
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }
}
