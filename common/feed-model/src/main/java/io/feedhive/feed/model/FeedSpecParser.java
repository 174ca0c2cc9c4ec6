package io.feedhive.feed.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses one YAML feed configuration file into a validated {@link FeedSpec}.
 * <p>
 * Required: {@code url} (alias {@code source}) and {@code sparql_endpoint} (alias {@code target}).
 * Optional fields receive the values in {@link FeedDefaults}. Any violation is reported as a
 * {@link FeedConfigException} naming the file.
 */
public final class FeedSpecParser {

    private static final Logger log = LoggerFactory.getLogger(FeedSpecParser.class);
    private static final Pattern ENV_KEY = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final ObjectMapper yamlMapper;

    public FeedSpecParser() {
        this(new ObjectMapper(new YAMLFactory()));
    }

    public FeedSpecParser(ObjectMapper yamlMapper) {
        this.yamlMapper = Objects.requireNonNull(yamlMapper, "yamlMapper");
    }

    public FeedSpec parse(Path file) {
        Objects.requireNonNull(file, "file");
        String fileName = file.getFileName().toString();
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new FeedConfigException(fileName, "unable to read file: " + e.getMessage(), e);
        }
        return parse(fileName, content);
    }

    public FeedSpec parse(String fileName, String content) {
        Objects.requireNonNull(fileName, "fileName");
        if (content == null || content.isBlank()) {
            throw new FeedConfigException(fileName, "file is empty");
        }
        FeedDocument document;
        try {
            document = yamlMapper.readValue(content, FeedDocument.class);
        } catch (MismatchedInputException e) {
            throw new FeedConfigException(fileName, "unexpected structure: " + e.getOriginalMessage(), e);
        } catch (JsonProcessingException e) {
            throw new FeedConfigException(fileName, "invalid YAML: " + e.getOriginalMessage(), e);
        }
        if (document == null) {
            throw new FeedConfigException(fileName, "file is empty");
        }
        if (!document.unrecognised.isEmpty()) {
            log.warn("Feed file {} has unrecognised keys {}; ignoring them", fileName, document.unrecognised.keySet());
        }
        return toSpec(fileName, document);
    }

    private FeedSpec toSpec(String fileName, FeedDocument doc) {
        String name = doc.name == null || doc.name.isBlank()
            ? FeedNames.fromFileName(fileName)
            : FeedNames.sanitize(doc.name);
        if (!FeedNames.isValid(name)) {
            throw new FeedConfigException(fileName,
                "feed name '" + name + "' must match [a-z0-9][a-z0-9.-]*");
        }
        String url = requireAbsoluteUri(fileName, "url", doc.url);
        String endpoint = requireAbsoluteUri(fileName, "sparql_endpoint", doc.sparqlEndpoint);

        OrderMode order;
        try {
            order = OrderMode.fromToken(doc.order);
        } catch (IllegalArgumentException e) {
            throw new FeedConfigException(fileName, e.getMessage(), e);
        }

        return FeedSpec.builder(name)
            .sourceUrl(url)
            .targetEndpoint(endpoint)
            .targetGraph(trimToDefault(doc.targetGraph, FeedDefaults.TARGET_GRAPH))
            .shape(trimToDefault(doc.shape, FeedDefaults.SHAPE))
            .pollingInterval(positiveSeconds(fileName, "polling_interval", doc.pollingInterval,
                FeedDefaults.POLLING_INTERVAL))
            .follow(orDefault(doc.follow, FeedDefaults.FOLLOW))
            .materialize(orDefault(doc.materialize, FeedDefaults.MATERIALIZE))
            .order(order)
            .lastVersionOnly(orDefault(doc.lastVersionOnly, FeedDefaults.LAST_VERSION_ONLY))
            .failureIsFatal(orDefault(doc.failureIsFatal, FeedDefaults.FAILURE_IS_FATAL))
            .concurrentFetches(concurrentFetches(fileName, doc.concurrentFetches))
            .queryTimeout(positiveSeconds(fileName, "query_timeout", doc.queryTimeout, FeedDefaults.QUERY_TIMEOUT))
            .forVirtuoso(orDefault(doc.forVirtuoso, FeedDefaults.FOR_VIRTUOSO))
            .before(timestamp(fileName, "before", doc.before))
            .after(timestamp(fileName, "after", doc.after))
            .accessToken(blankToNull(doc.accessToken))
            .perfName(blankToNull(doc.perfName))
            .environment(environment(fileName, doc.environment))
            .sourceFile(fileName)
            .build();
    }

    private static String requireAbsoluteUri(String fileName, String field, String value) {
        if (value == null || value.isBlank()) {
            throw new FeedConfigException(fileName, "missing required field '" + field + "'");
        }
        String trimmed = value.trim();
        try {
            URI uri = new URI(trimmed);
            if (!uri.isAbsolute()) {
                throw new FeedConfigException(fileName, "'" + field + "' must be an absolute URI but was '" + trimmed + "'");
            }
        } catch (URISyntaxException e) {
            throw new FeedConfigException(fileName, "'" + field + "' is not a valid URI: " + e.getMessage(), e);
        }
        return trimmed;
    }

    private static Duration positiveSeconds(String fileName, String field, Double seconds, Duration fallback) {
        if (seconds == null) {
            return fallback;
        }
        if (seconds.isNaN() || seconds <= 0) {
            throw new FeedConfigException(fileName, "'" + field + "' must be a positive number of seconds");
        }
        return Duration.ofMillis(Math.round(seconds * 1000));
    }

    private static int concurrentFetches(String fileName, Integer value) {
        if (value == null) {
            return FeedDefaults.CONCURRENT_FETCHES;
        }
        if (value < 1) {
            throw new FeedConfigException(fileName, "'concurrent_fetches' must be at least 1");
        }
        return value;
    }

    private static String timestamp(String fileName, String field, String value) {
        String trimmed = blankToNull(value);
        if (trimmed == null) {
            return null;
        }
        try {
            DateTimeFormatter.ISO_DATE_TIME.parse(trimmed);
            return trimmed;
        } catch (DateTimeParseException ignored) {
            // date without time is accepted too
        }
        try {
            DateTimeFormatter.ISO_DATE.parse(trimmed);
            return trimmed;
        } catch (DateTimeParseException e) {
            throw new FeedConfigException(fileName,
                "'" + field + "' must be an ISO-8601 date or timestamp but was '" + trimmed + "'", e);
        }
    }

    private static Map<String, String> environment(String fileName, Map<String, Object> raw) {
        if (raw == null || raw.isEmpty()) {
            return Map.of();
        }
        Map<String, String> env = new LinkedHashMap<>();
        raw.forEach((key, value) -> {
            if (key == null || !ENV_KEY.matcher(key).matches()) {
                throw new FeedConfigException(fileName, "environment key '" + key + "' is not a valid variable name");
            }
            if (value == null) {
                log.warn("Feed file {}: skipping environment variable '{}' with no value", fileName, key);
                return;
            }
            if (value instanceof Map<?, ?> || value instanceof Iterable<?>) {
                throw new FeedConfigException(fileName, "environment variable '" + key + "' must be a scalar");
            }
            env.put(key, String.valueOf(value));
        });
        return env;
    }

    private static boolean orDefault(Boolean value, boolean fallback) {
        return value == null ? fallback : value;
    }

    private static String trimToDefault(String value, String fallback) {
        String trimmed = blankToNull(value);
        return trimmed == null ? fallback : trimmed;
    }

    private static String blankToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
