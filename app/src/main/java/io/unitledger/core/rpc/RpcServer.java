package io.unitledger.core.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.micrometer.core.instrument.Timer;
import io.unitledger.core.audit.AuditEntry;
import io.unitledger.core.ledger.ForfeitSummary;
import io.unitledger.core.ledger.LedgerCore;
import io.unitledger.core.ledger.SponsorReceipt;
import io.unitledger.core.metrics.LedgerMetrics;
import io.unitledger.core.node.LedgerNode;
import io.unitledger.core.protocol.LedgerError;
import io.unitledger.core.protocol.LedgerException;
import io.unitledger.core.protocol.ProtocolLimits;
import io.unitledger.core.registry.AssetListing;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON-over-HTTP front end of a {@link LedgerNode}.
 *
 * The bearer token (when configured) authenticates the client process; the ledger
 * caller is whatever the request body names in {@code caller}.
 */
public final class RpcServer {
    private static final Logger LOG = Logger.getLogger(RpcServer.class.getName());
    private static final int DEFAULT_EVENT_PAGE = 500;
    private static final byte[] OPENAPI_SPEC = """
{
  "openapi": "3.0.3",
  "info": { "title": "Unit Ledger RPC API", "version": "1.0.0" },
  "paths": {
    "/status":  { "get":  { "summary": "Owner, engine and audit position" } },
    "/account": { "get":  { "summary": "Sponsor, balances and totals of an address",
                            "parameters": [ { "name": "addr", "in": "query", "required": true, "schema": { "type": "string" } } ] } },
    "/balance": { "get":  { "summary": "Balance of one asset",
                            "parameters": [ { "name": "addr", "in": "query", "required": true, "schema": { "type": "string" } },
                                            { "name": "asset", "in": "query", "required": true, "schema": { "type": "string" } } ] } },
    "/asset":   { "get":  { "summary": "Registry listing and cumulative sponsored units",
                            "parameters": [ { "name": "id", "in": "query", "required": true, "schema": { "type": "string" } } ] } },
    "/events":  { "get":  { "summary": "Audit entries from a sequence",
                            "parameters": [ { "name": "since", "in": "query", "schema": { "type": "integer" } },
                                            { "name": "limit", "in": "query", "schema": { "type": "integer" } } ] } },
    "/sponsor": { "post": { "summary": "Sponsor a beneficiary", "requestBody": { "content": { "application/json": { "schema": { "$ref": "#/components/schemas/SponsorRequest" } } } } } },
    "/consume": { "post": { "summary": "Debit a beneficiary (consuming engine only)", "requestBody": { "content": { "application/json": { "schema": { "$ref": "#/components/schemas/ConsumeRequest" } } } } } },
    "/clear":   { "post": { "summary": "Release the caller's sponsor when empty", "requestBody": { "content": { "application/json": { "schema": { "$ref": "#/components/schemas/CallerRequest" } } } } } },
    "/forfeit": { "post": { "summary": "Forfeit listed balances and release the sponsor if nothing is left", "requestBody": { "content": { "application/json": { "schema": { "$ref": "#/components/schemas/ForfeitRequest" } } } } } },
    "/admin/engine": { "post": { "summary": "Set the consuming engine (owner only)" } },
    "/admin/transfer-ownership": { "post": { "summary": "Nominate a new owner (owner only)" } },
    "/admin/accept-ownership": { "post": { "summary": "Accept a pending ownership nomination" } },
    "/admin/asset": { "post": { "summary": "Enable, disable, cap or uncap a listed asset (owner only; capUnits 0 lifts the cap)" } },
    "/bank/mint": { "post": { "summary": "Fund a holder in the simulated asset bank (owner only)" } },
    "/metrics": { "get":  { "summary": "Metrics scrape" } },
    "/openapi.json": { "get": { "summary": "This document" } }
  },
  "components": {
    "schemas": {
      "CallerRequest":  { "type": "object", "required": ["caller"], "properties": { "caller": { "type": "string" } } },
      "SponsorRequest": { "type": "object", "required": ["caller", "beneficiary", "asset", "units"],
                          "properties": { "caller": { "type": "string" }, "beneficiary": { "type": "string" },
                                          "asset": { "type": "string" }, "units": { "type": "integer", "format": "int64" } } },
      "ConsumeRequest": { "type": "object", "required": ["caller", "beneficiary", "asset", "units"],
                          "properties": { "caller": { "type": "string" }, "beneficiary": { "type": "string" },
                                          "asset": { "type": "string" }, "units": { "type": "integer", "format": "int64" } } },
      "ForfeitRequest": { "type": "object", "required": ["caller", "assets"],
                          "properties": { "caller": { "type": "string" }, "assets": { "type": "array", "items": { "type": "string" } } } }
    }
  }
}
""".getBytes(StandardCharsets.UTF_8);

    private final LedgerNode node;
    private final LedgerCore ledger;
    private final String bindAddress;
    private final int port;
    private final String authToken;
    private final ObjectMapper mapper;
    private HttpServer server;
    private ExecutorService executor;

    public RpcServer(LedgerNode node, String bindAddress, int port, String authToken) {
        this.node = node;
        this.ledger = node.core();
        this.bindAddress = (bindAddress == null || bindAddress.isBlank()) ? "127.0.0.1" : bindAddress;
        this.port = port;
        this.authToken = (authToken == null || authToken.isBlank()) ? null : authToken;
        this.mapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public void start() throws IOException {
        if (server != null) {
            throw new IllegalStateException("RPC server already running");
        }
        server = HttpServer.create(new InetSocketAddress(bindAddress, port), 0);
        server.createContext("/status", new StatusHandler());
        server.createContext("/account", new AccountHandler());
        server.createContext("/balance", new BalanceHandler());
        server.createContext("/asset", new AssetHandler());
        server.createContext("/events", new EventsHandler());
        server.createContext("/sponsor", new SponsorHandler());
        server.createContext("/consume", new ConsumeHandler());
        server.createContext("/clear", new ClearHandler());
        server.createContext("/forfeit", new ForfeitHandler());
        server.createContext("/admin/asset", new AssetAdminHandler());
        server.createContext("/admin/engine", new EngineHandler());
        server.createContext("/admin/transfer-ownership", new TransferOwnershipHandler());
        server.createContext("/admin/accept-ownership", new AcceptOwnershipHandler());
        server.createContext("/bank/mint", new MintHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/openapi.json", new OpenApiHandler());
        executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        server.start();
        LOG.info(() -> "RPC server listening on http://" + bindAddress + ':' + port + (authToken != null ? " (auth required)" : ""));
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
            server = null;
        }
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
    }

    /**
     * Common request plumbing: method check, auth, timing, and mapping of ledger
     * rejections to error bodies. Subclasses only produce the success response.
     */
    private abstract class Endpoint implements HttpHandler {
        private final String allowedMethod;

        Endpoint(String allowedMethod) {
            this.allowedMethod = allowedMethod;
        }

        abstract int respond(HttpExchange exchange) throws IOException;

        @Override
        public final void handle(HttpExchange exchange) throws IOException {
            String method = exchange.getRequestMethod();
            String path = exchange.getHttpContext().getPath();
            Timer.Sample sample = LedgerMetrics.startRequest();
            int status = 500;
            try {
                if (!allowedMethod.equalsIgnoreCase(method)) {
                    status = sendError(exchange, 405, "method_not_allowed", "Use " + allowedMethod + " for this endpoint");
                    return;
                }
                status = ensureAuthorized(exchange);
                if (status != -1) {
                    return;
                }
                status = respond(exchange);
            } catch (LedgerException e) {
                status = sendError(exchange, e.error().httpStatus(), e.error().code(), e.getMessage());
            } catch (BadRequest e) {
                status = sendError(exchange, 400, e.code, e.getMessage());
            } catch (Exception e) {
                LOG.log(Level.WARNING, "RPC handler for " + path + " failed", e);
                status = sendError(exchange, 500, "internal_error", "Unexpected server error");
            } finally {
                LedgerMetrics.stopRequest(sample, method, path, status);
                exchange.close();
            }
        }
    }

    private static final class BadRequest extends RuntimeException {
        final String code;

        BadRequest(String code, String message) {
            super(message);
            this.code = code;
        }
    }

    private int ensureAuthorized(HttpExchange exchange) throws IOException {
        if (authToken == null) {
            return -1;
        }
        List<String> authHeaders = exchange.getRequestHeaders().get("Authorization");
        if (authHeaders != null) {
            for (String header : authHeaders) {
                if (header != null && header.equals("Bearer " + authToken)) {
                    return -1;
                }
            }
        }
        String apiKey = exchange.getRequestHeaders().getFirst("X-API-Key");
        if (apiKey != null && apiKey.equals(authToken)) {
            return -1;
        }
        exchange.getResponseHeaders().set("WWW-Authenticate", "Bearer");
        return sendError(exchange, 401, "unauthorized", "Missing or invalid credentials");
    }

    // -------------------- reads --------------------

    final class StatusHandler extends Endpoint {
        StatusHandler() { super("GET"); }

        @Override
        int respond(HttpExchange exchange) throws IOException {
            ObjectNode resp = mapper.createObjectNode();
            resp.put("owner", ledger.owner().orElse(null));
            resp.put("pendingOwner", ledger.pendingOwner().orElse(null));
            resp.put("consumingEngine", ledger.consumingEngine().orElse(null));
            resp.put("sink", node.bank().address());
            resp.put("auditNextSequence", node.audit().nextSequence());
            return sendJson(exchange, 200, resp);
        }
    }

    final class AccountHandler extends Endpoint {
        AccountHandler() { super("GET"); }

        @Override
        int respond(HttpExchange exchange) throws IOException {
            String address = requiredParam(exchange.getRequestURI(), "addr");
            ObjectNode resp = mapper.createObjectNode();
            resp.put("address", address);
            resp.put("sponsor", ledger.sponsorOf(address).orElse(null));
            resp.put("activeAssetCount", ledger.activeAssetCount(address));
            resp.put("lifetimeAllocatedUnits", ledger.lifetimeAllocatedUnits(address));
            ObjectNode balances = resp.putObject("balances");
            for (Map.Entry<String, Long> entry : ledger.balancesOf(address).entrySet()) {
                balances.put(entry.getKey(), entry.getValue());
            }
            return sendJson(exchange, 200, resp);
        }
    }

    final class BalanceHandler extends Endpoint {
        BalanceHandler() { super("GET"); }

        @Override
        int respond(HttpExchange exchange) throws IOException {
            String address = requiredParam(exchange.getRequestURI(), "addr");
            String asset = requiredParam(exchange.getRequestURI(), "asset");
            ObjectNode resp = mapper.createObjectNode();
            resp.put("address", address);
            resp.put("asset", asset);
            resp.put("balance", ledger.balanceOf(address, asset));
            return sendJson(exchange, 200, resp);
        }
    }

    final class AssetHandler extends Endpoint {
        AssetHandler() { super("GET"); }

        @Override
        int respond(HttpExchange exchange) throws IOException {
            String asset = requiredParam(exchange.getRequestURI(), "id");
            Optional<AssetListing> listing = ledger.registry().lookup(asset);
            if (listing.isEmpty()) {
                return sendError(exchange, 404, "asset_not_found", "No registry listing for " + asset);
            }
            return sendJson(exchange, 200, assetJson(asset, listing.get()));
        }
    }

    final class EventsHandler extends Endpoint {
        EventsHandler() { super("GET"); }

        @Override
        int respond(HttpExchange exchange) throws IOException {
            long since = longParam(exchange.getRequestURI(), "since", 0L);
            long limit = longParam(exchange.getRequestURI(), "limit", DEFAULT_EVENT_PAGE);
            List<AuditEntry> entries = node.audit().entriesSince(since);
            ArrayNode array = mapper.createArrayNode();
            for (AuditEntry entry : entries) {
                if (array.size() >= limit) {
                    break;
                }
                array.add(mapper.valueToTree(entry));
            }
            ObjectNode resp = mapper.createObjectNode();
            resp.set("entries", array);
            // a short page resumes right after its last entry
            resp.put("nextSequence", Math.min(since + array.size(), node.audit().nextSequence()));
            return sendJson(exchange, 200, resp);
        }
    }

    // -------------------- ledger operations --------------------

    final class SponsorHandler extends Endpoint {
        SponsorHandler() { super("POST"); }

        @Override
        int respond(HttpExchange exchange) throws IOException {
            UnitsRequest req = readBody(exchange, UnitsRequest.class);
            SponsorReceipt receipt = ledger.sponsor(req.caller, req.beneficiary, req.asset, req.units);
            return sendJson(exchange, 200, receipt);
        }
    }

    final class ConsumeHandler extends Endpoint {
        ConsumeHandler() { super("POST"); }

        @Override
        int respond(HttpExchange exchange) throws IOException {
            UnitsRequest req = readBody(exchange, UnitsRequest.class);
            long remaining = ledger.consume(req.caller, req.beneficiary, req.asset, req.units);
            ObjectNode resp = mapper.createObjectNode()
                    .put("beneficiary", req.beneficiary)
                    .put("asset", req.asset)
                    .put("consumed", req.units)
                    .put("remaining", remaining);
            return sendJson(exchange, 200, resp);
        }
    }

    final class ClearHandler extends Endpoint {
        ClearHandler() { super("POST"); }

        @Override
        int respond(HttpExchange exchange) throws IOException {
            CallerRequest req = readBody(exchange, CallerRequest.class);
            String previous = ledger.clearSponsorIfEmpty(req.caller);
            ObjectNode resp = mapper.createObjectNode()
                    .put("beneficiary", req.caller)
                    .put("previousSponsor", previous)
                    .put("sponsorCleared", true);
            return sendJson(exchange, 200, resp);
        }
    }

    final class ForfeitHandler extends Endpoint {
        ForfeitHandler() { super("POST"); }

        @Override
        int respond(HttpExchange exchange) throws IOException {
            ForfeitRequest req = readBody(exchange, ForfeitRequest.class);
            if (req.assets != null && req.assets.size() > ProtocolLimits.MAX_FORFEIT_ASSETS) {
                throw new BadRequest("too_many_assets", "At most " + ProtocolLimits.MAX_FORFEIT_ASSETS + " assets per call");
            }
            ForfeitSummary summary = ledger.clearSponsorAndForfeit(req.caller, req.assets);
            ObjectNode resp = mapper.valueToTree(summary);
            resp.put("assetsCleared", summary.assetsCleared());
            return sendJson(exchange, 200, resp);
        }
    }

    // -------------------- admin --------------------

    final class AssetAdminHandler extends Endpoint {
        AssetAdminHandler() { super("POST"); }

        @Override
        int respond(HttpExchange exchange) throws IOException {
            AssetAdminRequest req = readBody(exchange, AssetAdminRequest.class);
            if (req.asset == null || req.asset.isBlank()) {
                throw new BadRequest("invalid_asset", "Field 'asset' is required");
            }
            AssetListing updated = node.configureAsset(req.caller, req.asset, req.enabled, req.capUnits);
            return sendJson(exchange, 200, assetJson(req.asset, updated));
        }
    }

    final class EngineHandler extends Endpoint {
        EngineHandler() { super("POST"); }

        @Override
        int respond(HttpExchange exchange) throws IOException {
            EngineRequest req = readBody(exchange, EngineRequest.class);
            ledger.setConsumingEngine(req.caller, req.engine);
            return sendJson(exchange, 200, mapper.createObjectNode().put("consumingEngine", req.engine));
        }
    }

    final class TransferOwnershipHandler extends Endpoint {
        TransferOwnershipHandler() { super("POST"); }

        @Override
        int respond(HttpExchange exchange) throws IOException {
            OwnershipRequest req = readBody(exchange, OwnershipRequest.class);
            ledger.transferOwnership(req.caller, req.newOwner);
            return sendJson(exchange, 200, mapper.createObjectNode().put("pendingOwner", req.newOwner));
        }
    }

    final class AcceptOwnershipHandler extends Endpoint {
        AcceptOwnershipHandler() { super("POST"); }

        @Override
        int respond(HttpExchange exchange) throws IOException {
            CallerRequest req = readBody(exchange, CallerRequest.class);
            ledger.acceptOwnership(req.caller);
            return sendJson(exchange, 200, mapper.createObjectNode().put("owner", req.caller));
        }
    }

    final class MintHandler extends Endpoint {
        MintHandler() { super("POST"); }

        @Override
        int respond(HttpExchange exchange) throws IOException {
            MintRequest req = readBody(exchange, MintRequest.class);
            if (ledger.owner().filter(o -> o.equals(req.caller)).isEmpty()) {
                throw new LedgerException(LedgerError.UNAUTHORIZED_CALLER, "Only the ledger owner may mint simulated assets");
            }
            if (req.holder == null || req.holder.isBlank() || req.asset == null || req.asset.isBlank() || req.amount <= 0) {
                throw new BadRequest("invalid_mint", "Fields 'holder', 'asset' and a positive 'amount' are required");
            }
            node.bank().mint(req.holder, req.asset, req.amount);
            ObjectNode resp = mapper.createObjectNode()
                    .put("holder", req.holder)
                    .put("asset", req.asset)
                    .put("holding", node.bank().holdingOf(req.holder, req.asset));
            return sendJson(exchange, 200, resp);
        }
    }

    final class MetricsHandler extends Endpoint {
        MetricsHandler() { super("GET"); }

        @Override
        int respond(HttpExchange exchange) throws IOException {
            byte[] payload = LedgerMetrics.scrapeMetrics().getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            exchange.sendResponseHeaders(200, payload.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(payload);
            }
            return 200;
        }
    }

    final class OpenApiHandler extends Endpoint {
        OpenApiHandler() { super("GET"); }

        @Override
        int respond(HttpExchange exchange) throws IOException {
            return sendJson(exchange, 200, OPENAPI_SPEC);
        }
    }

    // -------------------- helpers --------------------

    private <T> T readBody(HttpExchange exchange, Class<T> type) throws IOException {
        T req;
        try {
            req = mapper.readValue(exchange.getRequestBody(), type);
        } catch (JsonProcessingException e) {
            throw new BadRequest("invalid_json", "Failed to parse request body");
        }
        if (req == null) {
            throw new BadRequest("invalid_json", "Request body is required");
        }
        return req;
    }

    private ObjectNode assetJson(String asset, AssetListing l) {
        ObjectNode resp = mapper.createObjectNode();
        resp.put("asset", asset);
        resp.put("listed", l.listed());
        resp.put("enabled", l.enabled());
        resp.put("decimals", l.decimals());
        resp.put("unitsPerReferenceAmount", l.unitsPerReferenceAmount());
        if (l.capped()) {
            resp.put("capUnits", l.capUnits().getAsLong());
        } else {
            resp.putNull("capUnits");
        }
        resp.put("cumulativeSponsoredUnits", ledger.cumulativeSponsoredUnits(asset));
        resp.put("sinkBalance", node.bank().balanceOf(asset));
        return resp;
    }

    private int sendJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload;
        if (body instanceof byte[] bytes) {
            payload = bytes;
        } else if (body instanceof String str) {
            payload = str.getBytes(StandardCharsets.UTF_8);
        } else {
            payload = mapper.writeValueAsBytes(body);
        }
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(payload);
        }
        return status;
    }

    private int sendError(HttpExchange exchange, int status, String code, String message) throws IOException {
        ObjectNode node = mapper.createObjectNode();
        node.put("error", code);
        node.put("message", message);
        return sendJson(exchange, status, node);
    }

    private static String requiredParam(URI uri, String name) {
        String value = queryParam(uri, name);
        if (value == null || value.isBlank()) {
            throw new BadRequest("missing_" + name, "Query parameter '" + name + "' is required");
        }
        return value;
    }

    private static long longParam(URI uri, String name, long fallback) {
        String value = queryParam(uri, name);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            long parsed = Long.parseLong(value);
            if (parsed < 0) {
                throw new NumberFormatException();
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new BadRequest("invalid_" + name, "Query parameter '" + name + "' must be a non-negative integer");
        }
    }

    private static String queryParam(URI uri, String name) {
        String query = uri.getRawQuery();
        if (query == null) {
            return null;
        }
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            String[] kv = pair.split("=", 2);
            if (kv.length != 2) {
                continue;
            }
            String key = URLDecoder.decode(kv[0], StandardCharsets.UTF_8);
            if (name.equals(key)) {
                return URLDecoder.decode(kv[1], StandardCharsets.UTF_8);
            }
        }
        return null;
    }

    private static class CallerRequest {
        public String caller;
    }

    private static class UnitsRequest {
        public String caller;
        public String beneficiary;
        public String asset;
        public long units;
    }

    private static class ForfeitRequest {
        public String caller;
        public List<String> assets;
    }

    private static class EngineRequest {
        public String caller;
        public String engine;
    }

    private static class OwnershipRequest {
        public String caller;
        public String newOwner;
    }

    private static class AssetAdminRequest {
        public String caller;
        public String asset;
        public Boolean enabled;
        public Long capUnits;
    }

    private static class MintRequest {
        public String caller;
        public String holder;
        public String asset;
        public long amount;
    }
}
