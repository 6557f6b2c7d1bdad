package io.datawrangle.core.engine.builtin;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.datawrangle.core.connector.ConnectorSession;
import io.datawrangle.core.engine.Schemas;
import io.datawrangle.core.engine.StepKind;
import io.datawrangle.core.error.RunCancelledException;
import io.datawrangle.core.error.WrangleExecutionException;
import io.datawrangle.core.model.Dataset;
import io.datawrangle.core.model.ErrorPolicy;
import io.datawrangle.core.model.Granularity;
import io.datawrangle.core.model.Section;
import io.datawrangle.core.model.StepDescriptor;
import io.datawrangle.core.spi.Connector;
import io.datawrangle.core.spi.InvocableConnector;
import io.datawrangle.core.spi.StepContext;
import io.datawrangle.core.spi.WrangleStep;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code infer}: sends each row to an invocable connector (an inference endpoint by default) and
 * stores the answers. At most {@code concurrency} calls are in flight; results are reassembled in
 * row order regardless of completion order.
 */
final class InferStep implements WrangleStep {

    private static final Logger LOG = LoggerFactory.getLogger(InferStep.class);
    private static final AtomicInteger THREADS = new AtomicInteger();

    static final String KIND = "infer";
    static final int DEFAULT_CONCURRENCY = 4;
    private static final Duration DRAIN_TIMEOUT = Duration.ofSeconds(30);

    private final InvocableConnector connector;
    private final ObjectNode settings;
    private final String credentials;
    private final List<String> inputs;
    private final List<String> outputs;
    private final int concurrency;

    private InferStep(StepDescriptor descriptor, Connector connector) {
        if (!(connector instanceof InvocableConnector invocable)) {
            throw new IllegalArgumentException("Connector '" + connector.id() + "' cannot answer per-row requests");
        }
        ObjectNode config = descriptor.config();
        this.connector = invocable;
        this.settings = config.has("settings") ? (ObjectNode) config.get("settings") : config.objectNode();
        this.credentials = config.hasNonNull("credentials") ? config.get("credentials").asText() : null;
        this.inputs = descriptor.inputColumns();
        this.outputs = descriptor.outputColumns();
        this.concurrency = config.path("concurrency").asInt(DEFAULT_CONCURRENCY);
    }

    static StepKind kind() {
        return StepKind.builder(KIND, Section.WRANGLE)
                .description("Calls an inference endpoint once per row")
                .configuration(Schemas.object()
                        .property("connector", Schemas.string())
                        .property("settings", Schemas.map())
                        .property("credentials", Schemas.string())
                        .property("input", Schemas.columns())
                        .property("output", Schemas.columns())
                        .property("concurrency", Schemas.integer(1))
                        .required("settings", "output"))
                .granularity(Granularity.ROW)
                .factory((d, r) -> new InferStep(d, r.connector(d.config().path("connector").asText("http"))))
                .build();
    }

    @Override
    public Dataset apply(Dataset input, StepContext context) {
        inputs.forEach(input::columnIndex);
        if (input.isEmpty()) {
            return withOutputs(input, List.of());
        }
        try (ConnectorSession session = ConnectorSession.open(
                connector,
                settings,
                context.credentials(credentials, connector.id()),
                context.position(),
                context.kind())) {
            List<JsonNode> answers = dispatch(input, session, context);
            List<Integer> kept = new ArrayList<>();
            List<JsonNode> keptAnswers = new ArrayList<>();
            for (int r = 0; r < answers.size(); r++) {
                if (answers.get(r) != null) {
                    kept.add(r);
                    keptAnswers.add(answers.get(r));
                }
            }
            Dataset rows = kept.size() == input.rowCount() ? input : input.selectRows(kept);
            return withOutputs(rows, keptAnswers);
        }
    }

    /** Returns one answer per row, in row order; {@code null} marks a row dropped under skip_row. */
    private List<JsonNode> dispatch(Dataset input, ConnectorSession session, StepContext context) {
        int threads = Math.min(concurrency, input.rowCount());
        ExecutorService pool = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "datawrangle-infer-" + THREADS.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        LOG.debug("Dispatching rows: rows={}, concurrency={}, location={}",
                input.rowCount(), threads, session.location());
        try {
            List<Future<JsonNode>> futures = new ArrayList<>(input.rowCount());
            for (int r = 0; r < input.rowCount(); r++) {
                ObjectNode payload = payload(input, r);
                futures.add(pool.submit(() -> session.invoke(payload)));
            }
            return collect(futures, context);
        } finally {
            pool.shutdownNow();
            drain(pool, session);
        }
    }

    /** Waits for calls still in flight so that the session is not closed underneath them. */
    private static void drain(ExecutorService pool, ConnectorSession session) {
        try {
            if (!pool.awaitTermination(DRAIN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Calls still running after {}s, closing connector anyway: location={}",
                        DRAIN_TIMEOUT.toSeconds(), session.location());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static List<JsonNode> collect(List<Future<JsonNode>> futures, StepContext context) {
        List<JsonNode> answers = new ArrayList<>(futures.size());
        for (int r = 0; r < futures.size(); r++) {
            try {
                JsonNode answer = futures.get(r).get();
                answers.add(answer != null ? answer : NullNode.instance);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RunCancelledException(
                        "Interrupted while waiting for row " + r, context.position(), context.kind());
            } catch (ExecutionException e) {
                RuntimeException cause = e.getCause() instanceof RuntimeException runtime
                        ? runtime
                        : new IllegalStateException(e.getCause());
                if (context.errorPolicy() != ErrorPolicy.SKIP_ROW && cause instanceof WrangleExecutionException) {
                    throw cause;
                }
                context.rowFailed(r, cause);
                answers.add(null);
            }
        }
        return answers;
    }

    private ObjectNode payload(Dataset input, int row) {
        ObjectNode payload = input.rowAsObject(row);
        if (!inputs.isEmpty()) {
            payload.retain(inputs);
        }
        return payload;
    }

    private Dataset withOutputs(Dataset rows, List<JsonNode> answers) {
        Dataset result = rows;
        for (String output : outputs) {
            List<JsonNode> values = new ArrayList<>(answers.size());
            for (JsonNode answer : answers) {
                JsonNode value = outputs.size() == 1 ? answer : answer.path(output);
                values.add(value.isMissingNode() ? NullNode.instance : value);
            }
            result = result.withColumn(output, values);
        }
        return result;
    }
}
