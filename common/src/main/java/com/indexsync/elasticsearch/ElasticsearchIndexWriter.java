package com.indexsync.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchAsyncClient;
import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.HealthStatus;
import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch._types.Result;
import co.elastic.clients.elasticsearch.core.DeleteResponse;
import co.elastic.clients.elasticsearch.core.UpdateRequest;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.rest_client.RestClientTransport;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.indexsync.config.ElasticsearchConfig;
import com.indexsync.error.ErrorCode;
import com.indexsync.error.SyncException;
import com.indexsync.serde.JsonMappers;
import com.indexsync.sync.SyncContext;
import lombok.extern.slf4j.Slf4j;
import org.apache.http.HttpHost;
import org.apache.http.auth.AuthScope;
import org.apache.http.auth.UsernamePasswordCredentials;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.BasicCredentialsProvider;
import org.apache.http.util.EntityUtils;
import org.elasticsearch.client.Cancellable;
import org.elasticsearch.client.Request;
import org.elasticsearch.client.Response;
import org.elasticsearch.client.ResponseException;
import org.elasticsearch.client.ResponseListener;
import org.elasticsearch.client.RestClient;
import org.elasticsearch.client.RestClientBuilder;

import java.io.IOException;
import java.io.InputStream;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link IndexWriter} backed by the official Elasticsearch Java client.
 *
 * <p>Single-document writes go through {@link ElasticsearchAsyncClient} so the caller
 * can bound them by its {@link SyncContext} and abort them on cancellation.  Bulk
 * submission and provisioning use the low-level {@link RestClient} directly, since
 * their bodies are prebuilt JSON.</p>
 */
@Slf4j
public class ElasticsearchIndexWriter implements IndexWriter {

    private static final ContentType NDJSON = ContentType.create("application/x-ndjson", StandardCharsets.UTF_8);

    private final RestClient restClient;
    private final ElasticsearchClient client;
    private final ElasticsearchAsyncClient asyncClient;
    private final ObjectMapper objectMapper = JsonMappers.create();
    private final Refresh refresh;
    private volatile ClusterHealth lastHealth = ClusterHealth.UNREACHABLE;

    public ElasticsearchIndexWriter(ElasticsearchConfig config) {
        HttpHost[] hosts = config.getHosts().stream()
                .map(HttpHost::create)
                .toArray(HttpHost[]::new);

        RestClientBuilder builder = RestClient.builder(hosts)
                .setCompressionEnabled(config.isGzipEnabled())
                .setRequestConfigCallback(rcb -> rcb
                        .setConnectTimeout(config.getConnectTimeoutMs())
                        .setSocketTimeout(config.getSocketTimeoutMs()));

        BasicCredentialsProvider credentialsProvider = null;
        if (config.getUsername() != null && !config.getUsername().isEmpty()) {
            credentialsProvider = new BasicCredentialsProvider();
            credentialsProvider.setCredentials(AuthScope.ANY,
                    new UsernamePasswordCredentials(config.getUsername(), config.getPassword()));
        }
        BasicCredentialsProvider credentials = credentialsProvider;
        builder.setHttpClientConfigCallback(hcb -> {
            hcb.setMaxConnTotal(config.getMaxConnections())
                    .setMaxConnPerRoute(config.getMaxConnectionsPerRoute());
            if (credentials != null) {
                hcb.setDefaultCredentialsProvider(credentials);
            }
            return hcb;
        });

        this.restClient = builder.build();
        RestClientTransport transport = new RestClientTransport(restClient, new JacksonJsonpMapper(objectMapper));
        this.client = new ElasticsearchClient(transport);
        this.asyncClient = new ElasticsearchAsyncClient(transport);
        this.refresh = config.isRefreshOnWrite() ? Refresh.True : Refresh.False;
        log.info("Elasticsearch writer created hosts={} gzip={} maxConnections={}",
                config.getHosts(), config.isGzipEnabled(), config.getMaxConnections());
    }

    // ── Document writes ──────────────────────────────────────────────────

    @Override
    public void index(SyncContext ctx, String index, String id, Object document) throws SyncException {
        ctx.throwIfCancelled("index");
        await(ctx, asyncClient.index(i -> i.index(index).id(id).document(document).refresh(refresh)),
                "index", id);
        log.debug("Indexed doc={} index={}", id, index);
    }

    @Override
    public void upsert(SyncContext ctx, String index, String id, Object partial) throws SyncException {
        ctx.throwIfCancelled("update");
        UpdateRequest<Object, Object> request = UpdateRequest.of(u -> u
                .index(index)
                .id(id)
                .doc(partial)
                .docAsUpsert(true)
                .refresh(refresh));
        await(ctx, asyncClient.update(request, Object.class), "update", id);
        log.debug("Upserted doc={} index={}", id, index);
    }

    @Override
    public void delete(SyncContext ctx, String index, String id) throws SyncException {
        ctx.throwIfCancelled("delete");
        try {
            DeleteResponse response = await(ctx,
                    asyncClient.delete(d -> d.index(index).id(id).refresh(refresh)), "delete", id);
            if (response.result() == Result.NotFound) {
                log.debug("Delete of absent doc={} index={} treated as success", id, index);
            }
        } catch (SyncException e) {
            if (statusOf(e.getCause()) == 404) {
                log.debug("Delete of doc={} in missing index={} treated as success", id, index);
                return;
            }
            throw e;
        }
    }

    @Override
    public List<BulkItemFailure> bulk(SyncContext ctx, String ndjson, int operationCount) throws SyncException {
        ctx.throwIfCancelled("bulk");
        Request request = new Request("POST", "/_bulk");
        if (refresh == Refresh.True) {
            request.addParameter("refresh", "true");
        }
        request.setEntity(new StringEntity(ndjson, NDJSON));

        Response response = await(ctx, performAsync(request), "bulk", null);
        JsonNode body = readBody(response, "bulk");
        if (!body.path("errors").asBoolean(false)) {
            log.debug("Bulk of {} operations applied in {}ms", operationCount, body.path("took").asLong());
            return List.of();
        }
        List<BulkItemFailure> failures = bulkItemFailures(body);
        log.warn("Bulk of {} operations had {} failed items, first: {}",
                operationCount, failures.size(), failures.isEmpty() ? "none" : failures.get(0));
        return failures;
    }

    // ── Health ───────────────────────────────────────────────────────────

    @Override
    public ClusterHealth checkHealth() {
        ClusterHealth health;
        try {
            HealthStatus status = client.cluster().health().status();
            health = switch (status) {
                case Green -> ClusterHealth.GREEN;
                case Yellow -> ClusterHealth.YELLOW;
                default -> ClusterHealth.RED;
            };
        } catch (ElasticsearchException | IOException e) {
            log.warn("Elasticsearch health check failed: {}", e.getMessage());
            health = ClusterHealth.UNREACHABLE;
        }
        if (health != lastHealth) {
            log.info("Elasticsearch health changed {} -> {}", lastHealth, health);
        }
        lastHealth = health;
        return health;
    }

    @Override
    public ClusterHealth lastKnownHealth() {
        return lastHealth;
    }

    // ── Provisioning ─────────────────────────────────────────────────────

    @Override
    public boolean lifecyclePolicyExists(String name) throws SyncException {
        return exists(new Request("GET", "/_ilm/policy/" + name), "get lifecycle policy");
    }

    @Override
    public void putLifecyclePolicy(String name, String policyJson) throws SyncException {
        Request request = new Request("PUT", "/_ilm/policy/" + name);
        request.setJsonEntity(policyJson);
        perform(request, "put lifecycle policy");
    }

    @Override
    public boolean indexTemplateExists(String name) throws SyncException {
        return exists(new Request("HEAD", "/_index_template/" + name), "check index template");
    }

    @Override
    public void putIndexTemplate(String name, String templateJson) throws SyncException {
        Request request = new Request("PUT", "/_index_template/" + name);
        request.setJsonEntity(templateJson);
        perform(request, "put index template");
    }

    @Override
    public boolean indexExists(String index) throws SyncException {
        return exists(new Request("HEAD", "/" + index), "check index");
    }

    @Override
    public void createIndex(String index) throws SyncException {
        try {
            restClient.performRequest(new Request("PUT", "/" + index));
        } catch (ResponseException e) {
            String body = responseBody(e.getResponse());
            if (e.getResponse().getStatusLine().getStatusCode() == 400
                    && body.contains("resource_already_exists_exception")) {
                log.debug("Index {} already exists", index);
                return;
            }
            throw classify(e, "create index", index);
        } catch (IOException e) {
            throw classify(e, "create index", index);
        }
    }

    @Override
    public Set<String> aliasIndices(String alias) throws SyncException {
        Set<String> indices = new LinkedHashSet<>();
        try {
            Response response = restClient.performRequest(new Request("GET", "/_alias/" + alias));
            Iterator<String> names = readBody(response, "get alias").fieldNames();
            names.forEachRemaining(indices::add);
        } catch (ResponseException e) {
            if (e.getResponse().getStatusLine().getStatusCode() != 404) {
                throw classify(e, "get alias", alias);
            }
        } catch (IOException e) {
            throw classify(e, "get alias", alias);
        }
        return indices;
    }

    @Override
    public void moveAlias(String alias, String index, Collection<String> removeFrom) throws SyncException {
        ObjectNode body = objectMapper.createObjectNode();
        ArrayNode actions = body.putArray("actions");
        for (String old : removeFrom) {
            actions.addObject().putObject("remove").put("index", old).put("alias", alias);
        }
        actions.addObject().putObject("add")
                .put("index", index)
                .put("alias", alias)
                .put("is_write_index", true);

        Request request = new Request("POST", "/_aliases");
        request.setJsonEntity(body.toString());
        perform(request, "update aliases");
    }

    @Override
    public void close() throws IOException {
        if (restClient != null) {
            restClient.close();
        }
    }

    // ── Internals ────────────────────────────────────────────────────────

    /**
     * Waits for an in-flight request within the context's budget.  Cancelling the
     * context cancels the future, which aborts the underlying HTTP exchange.
     */
    private <R> R await(SyncContext ctx, CompletableFuture<R> future, String operation, String id)
            throws SyncException {
        try (SyncContext.Registration ignored = ctx.onCancel(() -> future.cancel(true))) {
            return future.get(ctx.remaining().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new SyncException(ErrorCode.ES_TIMEOUT, operation + " exceeded its deadline",
                    operation, id, e);
        } catch (CancellationException e) {
            throw new SyncException(ErrorCode.OPERATION_CANCELLED, operation + " cancelled", operation, id, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new SyncException(ErrorCode.OPERATION_CANCELLED, operation + " interrupted", operation, id, e);
        } catch (ExecutionException e) {
            throw classify(e.getCause(), operation, id);
        }
    }

    private CompletableFuture<Response> performAsync(Request request) {
        CompletableFuture<Response> future = new CompletableFuture<>();
        Cancellable cancellable = restClient.performRequestAsync(request, new ResponseListener() {
            @Override
            public void onSuccess(Response response) {
                future.complete(response);
            }

            @Override
            public void onFailure(Exception exception) {
                future.completeExceptionally(exception);
            }
        });
        future.whenComplete((response, error) -> {
            if (future.isCancelled()) {
                cancellable.cancel();
            }
        });
        return future;
    }

    private Response perform(Request request, String operation) throws SyncException {
        try {
            return restClient.performRequest(request);
        } catch (IOException e) {
            throw classify(e, operation, request.getEndpoint());
        }
    }

    private boolean exists(Request request, String operation) throws SyncException {
        try {
            Response response = restClient.performRequest(request);
            return response.getStatusLine().getStatusCode() == 200;
        } catch (ResponseException e) {
            if (e.getResponse().getStatusLine().getStatusCode() == 404) {
                return false;
            }
            throw classify(e, operation, request.getEndpoint());
        } catch (IOException e) {
            throw classify(e, operation, request.getEndpoint());
        }
    }

    private JsonNode readBody(Response response, String operation) throws SyncException {
        try (InputStream in = response.getEntity().getContent()) {
            return objectMapper.readTree(in);
        } catch (IOException e) {
            throw new SyncException(ErrorCode.ES_CONNECTION, "unreadable " + operation + " response", e);
        }
    }

    private static String responseBody(Response response) {
        try {
            return response.getEntity() != null ? EntityUtils.toString(response.getEntity()) : "";
        } catch (IOException e) {
            return "";
        }
    }

    static List<BulkItemFailure> bulkItemFailures(JsonNode body) {
        List<BulkItemFailure> failures = new ArrayList<>();
        int position = 0;
        for (JsonNode item : body.path("items")) {
            Iterator<JsonNode> actions = item.elements();
            if (actions.hasNext()) {
                JsonNode result = actions.next();
                if (result.has("error")) {
                    JsonNode error = result.path("error");
                    failures.add(new BulkItemFailure(position, result.path("_id").asText(),
                            result.path("status").asInt(), error.path("type").asText(),
                            error.path("reason").asText()));
                }
            }
            position++;
        }
        return failures;
    }

    /**
     * Maps a client failure onto an error code by HTTP status, falling back to
     * connection-level classification.
     */
    static SyncException classify(Throwable failure, String operation, String id) {
        Throwable cause = failure;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof SyncException) {
            return (SyncException) cause;
        }

        int status = statusOf(cause);
        String message = operation + " failed" + (status > 0 ? " with status " + status : "")
                + ": " + cause.getMessage();
        ErrorCode code;
        if (status > 0) {
            code = codeForStatus(status);
        } else if (hasCause(cause, SocketTimeoutException.class)) {
            code = ErrorCode.ES_TIMEOUT;
        } else {
            code = ErrorCode.ES_CONNECTION;
        }
        return new SyncException(code, message, operation, id, cause);
    }

    /** 409 is a conflict, 400 a rejection; any other status is worth retrying. */
    static ErrorCode codeForStatus(int status) {
        if (status == 409) {
            return ErrorCode.ES_CONFLICT;
        }
        if (status == 400) {
            return ErrorCode.ES_REJECTED;
        }
        return ErrorCode.ES_INDEX;
    }

    /** HTTP status carried anywhere in the cause chain, or -1. */
    static int statusOf(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof ElasticsearchException) {
                return ((ElasticsearchException) t).status();
            }
            if (t instanceof ResponseException) {
                return ((ResponseException) t).getResponse().getStatusLine().getStatusCode();
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return -1;
    }

    private static boolean hasCause(Throwable failure, Class<? extends Throwable> type) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (type.isInstance(t)) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }
}
