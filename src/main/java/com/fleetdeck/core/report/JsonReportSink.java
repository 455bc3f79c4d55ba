package com.fleetdeck.core.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes each report as JSON. Pretty-printed for one-shot output, one line
 * per report when streaming a live view.
 */
public class JsonReportSink<T> implements ReportSink<T> {

    private final ObjectMapper objectMapper;
    private final PrintStream out;
    private final boolean pretty;

    public JsonReportSink(PrintStream out, boolean pretty) {
        this.out = out;
        this.pretty = pretty;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
    }

    @Override
    public void accept(Report<T> report) {
        out.println(write(report));
        out.flush();
    }

    @Override
    public void onRoundFailed(Throwable error) {
        var body = new LinkedHashMap<String, Object>();
        body.put("error", error.getClass().getSimpleName());
        body.put("message", error.getMessage());
        out.println(writeValue(body));
        out.flush();
    }

    String write(Report<T> report) {
        var body = new LinkedHashMap<String, Object>();
        body.put("roundId", report.roundId());
        body.put("startedAt", report.startedAt());
        body.put("completedAt", report.completedAt());
        body.put("summary", Map.of(
                "total", report.total(),
                "succeeded", report.succeeded(),
                "timedOut", report.timedOut(),
                "connectionFailed", report.connectionFailed(),
                "commandFailed", report.commandFailed(),
                "skipped", report.skipped()));
        body.put("results", report.results());
        return writeValue(body);
    }

    private String writeValue(Object value) {
        try {
            return pretty
                    ? objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value)
                    : objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise report: " + e.getMessage(), e);
        }
    }
}
