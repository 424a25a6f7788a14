package com.labelops.integration.telegram;

import com.labelops.config.ConfigStore;
import com.labelops.config.UnknownClientException;
import com.labelops.logging.AppLogger;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Long-polls the Bot API, answers operator commands and drops routed shipment text into client
 * inboxes for the daemon to pick up. Chats outside the allowlist get no answer.
 */
public final class TelegramIngestBot {
    private static final Logger LOGGER = AppLogger.get();
    static final int POLL_TIMEOUT_SECONDS = 25;
    private static final Duration ERROR_BACKOFF = Duration.ofSeconds(5);

    static final String HELP_TEXT = "LabelOps Telegram ingest bot. Send text-only orders. Optional first line: client_01.";
    static final String TEXT_ONLY = "Text only, paste addresses as text.";

    private final TelegramApi api;
    private final AllowlistStore allowlistStore;
    private final IngestRouter router;
    private final InboxWriter inboxWriter;
    private final ConfigStore configStore;

    private volatile boolean running;
    private long nextOffset;
    private Thread pollThread;

    public TelegramIngestBot(TelegramApi api,
                             AllowlistStore allowlistStore,
                             IngestRouter router,
                             InboxWriter inboxWriter,
                             ConfigStore configStore) {
        this.api = Objects.requireNonNull(api, "api");
        this.allowlistStore = Objects.requireNonNull(allowlistStore, "allowlistStore");
        this.router = Objects.requireNonNull(router, "router");
        this.inboxWriter = Objects.requireNonNull(inboxWriter, "inboxWriter");
        this.configStore = Objects.requireNonNull(configStore, "configStore");
    }

    public synchronized void start() throws IOException {
        if (running) {
            return;
        }
        allowlistStore.load();
        running = true;
        pollThread = new Thread(this::pollLoop, "labelops-telegram");
        pollThread.setDaemon(true);
        pollThread.start();
        LOGGER.info("Telegram ingest bot started");
    }

    public void stop() throws InterruptedException {
        Thread thread;
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
            thread = pollThread;
        }
        thread.interrupt();
        thread.join(Duration.ofSeconds(POLL_TIMEOUT_SECONDS + 5L).toMillis());
        LOGGER.info("Telegram ingest bot stopped");
    }

    /**
     * Fetches and handles one batch of updates.
     *
     * @return number of updates received
     */
    public int pollOnce(int timeoutSeconds) throws TelegramApiException {
        List<TelegramUpdate> updates = api.getUpdates(nextOffset, timeoutSeconds);
        for (TelegramUpdate update : updates) {
            nextOffset = Math.max(nextOffset, update.updateId() + 1);
            if (update.message() != null) {
                handle(update.message());
            }
        }
        return updates.size();
    }

    void handle(InboundMessage message) {
        AllowlistConfig allowlist;
        try {
            allowlist = allowlistStore.load();
        } catch (IOException ex) {
            LOGGER.log(Level.SEVERE, "Telegram allowlist unreadable; ignoring message", ex);
            return;
        }
        if (!allowlist.isAllowed(message.chatId())) {
            LOGGER.info("Ignored message from chat_id=%d (not allowlisted)".formatted(message.chatId()));
            return;
        }
        if (message.isText() && message.text().strip().startsWith("/")) {
            handleCommand(message, allowlist);
            return;
        }

        RoutingDecision decision = router.route(message, allowlist);
        if (!decision.accepted()) {
            LOGGER.info("Rejected message from chat_id=%d: %s".formatted(message.chatId(), decision.reason()));
            reply(message.chatId(), message.hasMedia() ? TEXT_ONLY : "Not saved: " + decision.reason());
            return;
        }
        try {
            Path inbox = configStore.resolve(decision.clientId()).folders().inTxt();
            Path written = inboxWriter.write(inbox, message.chatId(), decision.content());
            LOGGER.info("Saved message chat_id=%d client_id=%s filename=%s length=%d".formatted(
                message.chatId(), decision.clientId(), written.getFileName(), decision.content().length()));
            reply(message.chatId(), "Saved for %s: %s".formatted(decision.clientId(), written.getFileName()));
        } catch (UnknownClientException | IOException ex) {
            LOGGER.log(Level.WARNING, "Could not save message for " + decision.clientId(), ex);
            reply(message.chatId(), "Not saved: " + ex.getMessage());
        }
    }

    private void handleCommand(InboundMessage message, AllowlistConfig allowlist) {
        String[] parts = message.text().strip().split("\\s+");
        String command = parts[0].toLowerCase(Locale.ROOT);
        int mention = command.indexOf('@');
        if (mention > 0) {
            command = command.substring(0, mention);
        }
        long chatId = message.chatId();
        List<String> clients = configStore.current().clientIds();
        switch (command) {
            case "/start", "/help" -> reply(chatId, HELP_TEXT);
            case "/chatid" -> reply(chatId, Long.toString(chatId));
            case "/clients" -> reply(chatId, clients.isEmpty() ? "No clients configured." : String.join("\n", clients));
            case "/status" -> reply(chatId, "Bot running. Allowlisted chats: %d. Clients: %s.".formatted(
                allowlist.allowedChatIds().size(), clients.isEmpty() ? "None found" : String.join(", ", clients)));
            case "/setclient" -> setClient(chatId, parts, allowlist, clients);
            default -> reply(chatId, "Unknown command. " + HELP_TEXT);
        }
    }

    private void setClient(long chatId, String[] parts, AllowlistConfig allowlist, List<String> clients) {
        if (parts.length < 2) {
            reply(chatId, "Usage: /setclient client_01");
            return;
        }
        String clientId = parts[1].trim().toLowerCase(Locale.ROOT);
        if (!IngestRouter.CLIENT_LINE.matcher(clientId).matches()) {
            reply(chatId, "Invalid client ID. Use client_01 format.");
            return;
        }
        if (!clients.contains(clientId)) {
            reply(chatId, "Unknown client " + clientId + ".");
            return;
        }
        try {
            allowlistStore.save(allowlist.withDefaultClient(chatId, clientId));
            reply(chatId, "Default client set to %s.".formatted(clientId));
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "Could not save Telegram allowlist", ex);
            reply(chatId, "Could not save default client.");
        }
    }

    private void reply(long chatId, String text) {
        try {
            api.sendMessage(chatId, text);
        } catch (TelegramApiException ex) {
            LOGGER.warning("Telegram reply to chat_id=%d failed: %s".formatted(chatId, ex.getMessage()));
        }
    }

    private void pollLoop() {
        while (running) {
            try {
                pollOnce(POLL_TIMEOUT_SECONDS);
            } catch (TelegramApiException ex) {
                if (!running) {
                    return;
                }
                LOGGER.warning("Telegram poll failed: " + ex.getMessage());
                if (!sleep(ERROR_BACKOFF)) {
                    return;
                }
            } catch (RuntimeException ex) {
                LOGGER.log(Level.SEVERE, "Telegram update handling failed", ex);
                if (!sleep(ERROR_BACKOFF)) {
                    return;
                }
            }
        }
    }

    private static boolean sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
