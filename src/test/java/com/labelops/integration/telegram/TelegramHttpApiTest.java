package com.labelops.integration.telegram;

import com.sun.net.httpserver.HttpServer;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TelegramHttpApiTest {

    private static final String TOKEN = "123:secret";

    private HttpServer server;
    private final List<String> paths = new CopyOnWriteArrayList<>();
    private final List<JSONObject> bodies = new CopyOnWriteArrayList<>();

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    private TelegramHttpApi serve(int status, String answer) throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            paths.add(exchange.getRequestURI().getPath());
            bodies.add(new JSONObject(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8)));
            byte[] bytes = answer.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
        String baseUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/";
        return new TelegramHttpApi(HttpClient.newHttpClient(), baseUrl, TOKEN);
    }

    @Test
    void getUpdatesParsesTextMediaAndOtherUpdates() throws Exception {
        TelegramHttpApi api = serve(200, """
            {"ok": true, "result": [
              {"update_id": 10, "message": {"chat": {"id": 42}, "text": "Jane Doe"}},
              {"update_id": 11, "message": {"chat": {"id": 42}, "photo": [{}], "caption": "look"}},
              {"update_id": 12, "edited_message": {"chat": {"id": 42}, "text": "x"}}
            ]}""");

        List<TelegramUpdate> updates = api.getUpdates(10, 0);

        assertEquals(List.of("/bot123:secret/getUpdates"), paths);
        assertEquals(10, bodies.get(0).getLong("offset"));
        assertEquals(3, updates.size());
        assertEquals(InboundMessage.text(42, "Jane Doe"), updates.get(0).message());
        assertTrue(updates.get(1).message().hasMedia());
        assertFalse(updates.get(1).message().isText());
        assertNull(updates.get(2).message());
    }

    @Test
    void sendMessagePostsChatAndText() throws Exception {
        TelegramHttpApi api = serve(200, "{\"ok\": true, \"result\": {}}");

        api.sendMessage(42, "Saved");

        assertEquals("/bot123:secret/sendMessage", paths.get(0));
        assertEquals(42, bodies.get(0).getLong("chat_id"));
        assertEquals("Saved", bodies.get(0).getString("text"));
    }

    @Test
    void apiErrorsDoNotLeakTheToken() throws Exception {
        TelegramHttpApi api = serve(401, "{\"ok\": false, \"description\": \"Unauthorized\"}");

        TelegramApiException ex = assertThrows(TelegramApiException.class, () -> api.sendMessage(42, "hi"));

        assertEquals("sendMessage returned HTTP 401: Unauthorized", ex.getMessage());
        assertFalse(ex.getMessage().contains("secret"));
    }

    @Test
    void blankTokenIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new TelegramHttpApi(" "));
    }
}
