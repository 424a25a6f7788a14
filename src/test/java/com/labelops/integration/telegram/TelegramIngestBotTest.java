package com.labelops.integration.telegram;

import com.labelops.TestFixtures;
import com.labelops.config.ConfigStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TelegramIngestBotTest {

    private static final long CHAT = 42L;

    @TempDir
    Path root;

    private ConfigStore store;
    private AllowlistStore allowlist;
    private FakeApi api;
    private TelegramIngestBot bot;

    @BeforeEach
    void setUp() throws Exception {
        store = TestFixtures.store(root);
        Path allowlistFile = root.resolve("config/telegram_allowlist.json");
        Files.writeString(allowlistFile, "{\"allowed_chat_ids\": [42]}");
        allowlist = new AllowlistStore(allowlistFile);
        api = new FakeApi();
        bot = new TelegramIngestBot(api, allowlist,
            new IngestRouter(() -> store.current().clientIds(), null),
            new InboxWriter(Clock.fixed(Instant.parse("2026-10-19T08:30:00Z"), ZoneOffset.UTC)),
            store);
    }

    private String lastReply() {
        return api.sent.get(api.sent.size() - 1);
    }

    @Test
    void savesShipmentTextIntoClientInbox() throws Exception {
        bot.handle(InboundMessage.text(CHAT, TestFixtures.GRACE));

        assertEquals("Saved for client_01: telegram_20261019_083000_42.txt", lastReply());
        Path saved = store.resolve("client_01").folders().inTxt().resolve("telegram_20261019_083000_42.txt");
        assertEquals(TestFixtures.GRACE, Files.readString(saved));
    }

    @Test
    void chatsOutsideAllowlistGetNoAnswer() throws Exception {
        bot.handle(InboundMessage.text(7L, TestFixtures.GRACE));
        bot.handle(InboundMessage.text(7L, "/help"));

        assertTrue(api.sent.isEmpty());
        assertFalse(Files.exists(store.resolve("client_01").folders().inTxt()));
    }

    @Test
    void mediaAndBadRoutingAreRefusedWithReason() {
        bot.handle(new InboundMessage(CHAT, null, true));
        assertEquals(TelegramIngestBot.TEXT_ONLY, lastReply());

        bot.handle(InboundMessage.text(CHAT, "client_07\nJane Doe\n1 Road"));
        assertEquals("Not saved: unknown client client_07", lastReply());
    }

    @Test
    void answersInformationCommands() {
        bot.handle(InboundMessage.text(CHAT, "/start"));
        assertEquals(TelegramIngestBot.HELP_TEXT, lastReply());

        bot.handle(InboundMessage.text(CHAT, "/chatid"));
        assertEquals("42", lastReply());

        bot.handle(InboundMessage.text(CHAT, "/clients@LabelOpsBot"));
        assertTrue(lastReply().contains("client_01"));
        assertTrue(lastReply().contains("client_02"));

        bot.handle(InboundMessage.text(CHAT, "/status"));
        assertTrue(lastReply().startsWith("Bot running. Allowlisted chats: 1."));

        bot.handle(InboundMessage.text(CHAT, "/nope"));
        assertEquals("Unknown command. " + TelegramIngestBot.HELP_TEXT, lastReply());
    }

    @Test
    void setClientValidatesAndPersistsTheChatDefault() throws Exception {
        bot.handle(InboundMessage.text(CHAT, "/setclient"));
        assertEquals("Usage: /setclient client_01", lastReply());

        bot.handle(InboundMessage.text(CHAT, "/setclient acme"));
        assertEquals("Invalid client ID. Use client_01 format.", lastReply());

        bot.handle(InboundMessage.text(CHAT, "/setclient client_09"));
        assertEquals("Unknown client client_09.", lastReply());

        bot.handle(InboundMessage.text(CHAT, "/setclient CLIENT_02"));
        assertEquals("Default client set to client_02.", lastReply());
        assertEquals(Optional.of("client_02"), allowlist.load().defaultClientFor(CHAT));

        bot.handle(InboundMessage.text(CHAT, TestFixtures.MARTIN));
        Path inbox = store.resolve("client_02").folders().inTxt();
        assertTrue(inbox.endsWith("incoming"));
        assertTrue(Files.exists(inbox.resolve("telegram_20261019_083000_42.txt")));
    }

    @Test
    void pollingAdvancesTheOffsetPastHandledUpdates() throws Exception {
        api.batches.add(List.of(
            new TelegramUpdate(5, InboundMessage.text(CHAT, "/chatid")),
            new TelegramUpdate(7, null)));

        assertEquals(2, bot.pollOnce(0));
        assertEquals(0, bot.pollOnce(0));

        assertEquals(List.of(0L, 8L), api.offsets);
        assertEquals(List.of("42"), api.sent);
    }

    private static final class FakeApi implements TelegramApi {
        final Deque<List<TelegramUpdate>> batches = new ArrayDeque<>();
        final List<Long> offsets = new ArrayList<>();
        final List<String> sent = new ArrayList<>();

        @Override
        public List<TelegramUpdate> getUpdates(long offset, int timeoutSeconds) {
            offsets.add(offset);
            return batches.isEmpty() ? List.of() : batches.poll();
        }

        @Override
        public void sendMessage(long chatId, String text) {
            sent.add(text);
        }
    }
}
