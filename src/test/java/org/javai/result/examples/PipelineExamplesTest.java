package org.javai.result.examples;

import org.javai.result.AsyncResult;
import org.javai.result.Cleanup;
import org.javai.result.Resources;
import org.javai.result.Result;
import org.javai.result.boundary.Boundary;
import org.javai.result.ops.Capture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end pipelines combining capture, scoped resources and async steps.
 */
public class PipelineExamplesTest {

    private Boundary boundary;
    private List<Capture> reported;
    private List<String> log;

    @BeforeEach
    void setUp() {
        reported = Collections.synchronizedList(new ArrayList<>());
        log = Collections.synchronizedList(new ArrayList<>());
        boundary = Boundary.withReporter(reported::add);
    }

    @Test
    void mapThenBind_producesString() {
        Result<String, String> result = Result.<Integer, String>success(5)
                .map(x -> x * 2)
                .bind(x -> x > 5 ? Result.<String, String>success(x.toString()) : Result.<String, String>failure("too small"));

        assertThat(result.value()).isEqualTo("10");
    }

    @Test
    void exceptionFirstCapture_logThenTranslate() {
        Result<Integer, String> result = boundary.call("Integer.parseInt", () -> Integer.parseInt("forty-two"))
                .tapError(e -> log.add("logged " + e.getClass().getSimpleName()))
                .mapError(e -> "Invalid number: " + e.getMessage());

        assertThat(result.error()).isEqualTo("Invalid number: For input string: \"forty-two\"");
        assertThat(log).containsExactly("logged NumberFormatException");
        assertThat(reported).hasSize(1);
    }

    @Test
    void usingWithCapture_readsFirstLine() {
        Result<BufferedReader, String> opened = Result.success(new BufferedReader(new StringReader("header\nrow")));

        Result<String, String> firstLine = Resources.using(opened, reader ->
                boundary.call("Reader.readLine", reader::readLine, e -> "read failed: " + e.getMessage()));

        assertThat(firstLine.value()).isEqualTo("header");
    }

    @Test
    void usingWithCapture_closedReaderBecomesFailure() throws IOException {
        BufferedReader reader = new BufferedReader(new StringReader("data"));
        reader.close();

        Result<String, String> result = Resources.using(Result.<BufferedReader, String>success(reader), r ->
                boundary.call("Reader.readLine", r::readLine, e -> "read failed: " + e.getMessage()));

        assertThat(result.error()).isEqualTo("read failed: Stream closed");
    }

    @Test
    void asyncPipeline_fetchValidateEnrich() {
        AtomicInteger fetches = new AtomicInteger();

        AsyncResult<String, String> pipeline = boundary
                .callAsync("Orders.fetch",
                        () -> CompletableFuture.supplyAsync(() -> {
                            fetches.incrementAndGet();
                            return "order-17";
                        }),
                        e -> "fetch failed: " + e.getMessage(),
                        Cleanup.of(() -> log.add("connection released")))
                .ensure(id -> id.startsWith("order-"), "unexpected id")
                .bindIf(id -> id.endsWith("-0"), id -> Result.success(id.toUpperCase()))
                .mapAsync(id -> enrich(id))
                .tap(summary -> log.add("done " + summary));

        Result<String, String> result = pipeline.join();

        assertThat(result.value()).isEqualTo("ORDER-17 (priority)");
        assertThat(fetches).hasValue(1);
        assertThat(log).containsExactly("connection released", "done ORDER-17 (priority)");
    }

    @Test
    void asyncPipeline_failureSkipsRemainingSteps() {
        Result<String, String> result = boundary
                .callAsync("Orders.fetch",
                        () -> CompletableFuture.<String>failedFuture(new IOException("connection refused")),
                        e -> "fetch failed: " + e.getMessage())
                .mapAsync(id -> enrich(id))
                .tapError(e -> log.add("alert " + e))
                .join();

        assertThat(result.error()).isEqualTo("fetch failed: connection refused");
        assertThat(log).containsExactly("alert fetch failed: connection refused");
    }

    @Test
    void asyncPipeline_recoverWithDefault() {
        String summary = AsyncResult.<String, String>failure("cache miss")
                .recover(e -> "default")
                .match(v -> "value: " + v, e -> "error: " + e)
                .join();

        assertThat(summary).isEqualTo("value: default");
    }

    private CompletionStage<String> enrich(String id) {
        return CompletableFuture.supplyAsync(() -> id.toUpperCase() + " (priority)");
    }
}
