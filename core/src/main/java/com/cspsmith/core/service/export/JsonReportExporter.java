package com.cspsmith.core.service.export;

import com.cspsmith.core.service.PolicyRun;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** 실행 리포트 JSON 입출력 (Instant 는 ISO-8601) */
public final class JsonReportExporter {

    private static final Logger LOG = LoggerFactory.getLogger(JsonReportExporter.class);

    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public Path export(PolicyRun run, Path file) throws IOException {
        if (run == null) throw new IllegalArgumentException("run is null");
        return write(PolicyReport.from(run), file);
    }

    public Path write(PolicyReport report, Path file) throws IOException {
        if (report == null) throw new IllegalArgumentException("report is null");
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        om.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), report);
        LOG.info("Report written: {}", file.toAbsolutePath());
        return file;
    }

    public PolicyReport read(Path file) throws IOException {
        PolicyReport r = om.readValue(file.toFile(), PolicyReport.class);
        if (!"1".equals(r.v)) {
            throw new IllegalArgumentException("Unsupported report version: " + r.v);
        }
        return r;
    }

    public String toJson(PolicyReport report) throws IOException {
        return om.writerWithDefaultPrettyPrinter().writeValueAsString(report);
    }
}
