package io.caretaker.core.config;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.caretaker.core.config.model.BackupConfig;
import io.caretaker.core.config.model.CaretakerConfig;
import io.caretaker.core.config.model.MonitorConfig;
import io.caretaker.core.config.model.NotificationConfig;
import io.caretaker.core.config.model.SlackConfig;
import io.caretaker.core.scheduler.Trigger;
import java.io.IOException;
import java.lang.reflect.RecordComponent;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Loads {@link CaretakerConfig} from a JSON file. Values in the file are deep-merged over the
 * defaults, then a small set of environment variables override connection secrets.
 */
public final class ConfigService {
    public static final String ENV_DATABASE_URL = "DATABASE_URL";
    public static final String ENV_FEEDBACK_DATABASE_URL = "FEEDBACK_DATABASE_URL";
    public static final String ENV_SLACK_BOT_TOKEN = "SLACK_BOT_TOKEN";
    public static final String ENV_SLACK_CHANNEL = "SLACK_CHANNEL";
    public static final String ENV_SLACK_WEBHOOK_URL = "SLACK_WEBHOOK_URL";

    private final ObjectMapper mapper;
    private final Map<String, String> environment;

    public ConfigService() {
        this(System.getenv());
    }

    public ConfigService(Map<String, String> environment) {
        this.environment = Map.copyOf(Objects.requireNonNull(environment, "environment must not be null"));
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public CaretakerConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        CaretakerConfig config;
        if (!Files.exists(configPath)) {
            config = CaretakerConfig.defaults();
        } else {
            config = readOverDefaults(configPath);
        }
        return applyEnvironment(config);
    }

    public void save(Path configPath, CaretakerConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    public InitResult init(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        boolean overwritten = false;

        CaretakerConfig config;
        if (created || overwrite) {
            config = CaretakerConfig.defaults();
            overwritten = !created;
        } else {
            config = readOverDefaults(configPath);
        }

        save(configPath, config);
        return new InitResult(configPath, created, overwritten);
    }

    /**
     * Rejects values that would otherwise fail later inside a running job.
     */
    public void validate(CaretakerConfig config) {
        List<String> problems = new ArrayList<>();
        if (config.scheduler().tickSeconds() <= 0) {
            problems.add("scheduler.tickSeconds must be > 0");
        }
        if (config.scheduler().timeZone() != null && !config.scheduler().timeZone().isBlank()) {
            try {
                ZoneId.of(config.scheduler().timeZone());
            } catch (DateTimeException e) {
                problems.add("scheduler.timeZone is not a valid zone id: " + config.scheduler().timeZone());
            }
        }

        BackupConfig backup = config.backup();
        if (backup.dumpTimeoutSeconds() <= 0) {
            problems.add("backup.dumpTimeoutSeconds must be > 0");
        }
        if (isBlank(backup.backupDir())) {
            problems.add("backup.backupDir is required");
        }
        try {
            Trigger.dailyAt(backup.backupTime());
        } catch (ConfigException e) {
            problems.add("backup.backupTime " + e.getMessage());
        }

        MonitorConfig monitor = config.monitor();
        if (monitor.intervalMinutes() <= 0) {
            problems.add("monitor.intervalMinutes must be > 0");
        }
        checkPercent(problems, "monitor.cpuThreshold", monitor.cpuThreshold());
        checkPercent(problems, "monitor.memThreshold", monitor.memThreshold());
        checkPercent(problems, "monitor.diskThreshold", monitor.diskThreshold());

        double threshold = config.feedback().threshold();
        if (threshold < 0.0 || threshold > 1.0) {
            problems.add("feedback.threshold must be within [0, 1]");
        }
        if (config.feedback().intervalMinutes() <= 0) {
            problems.add("feedback.intervalMinutes must be > 0");
        }

        if (!problems.isEmpty()) {
            throw new ConfigException("Invalid configuration: " + String.join("; ", problems));
        }
    }

    public String toPrettyJson(CaretakerConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    private CaretakerConfig applyEnvironment(CaretakerConfig config) {
        CaretakerConfig result = config;
        String databaseUrl = env(ENV_DATABASE_URL);
        if (databaseUrl != null) {
            result = result.withBackup(result.backup().withDatabaseUrl(databaseUrl));
        }
        String feedbackUrl = env(ENV_FEEDBACK_DATABASE_URL);
        if (feedbackUrl != null) {
            result = result.withFeedback(result.feedback().withDatabaseUrl(feedbackUrl));
        }

        SlackConfig slack = result.notification().slack();
        String token = env(ENV_SLACK_BOT_TOKEN);
        String channel = env(ENV_SLACK_CHANNEL);
        String webhook = env(ENV_SLACK_WEBHOOK_URL);
        if (token != null || channel != null || webhook != null) {
            SlackConfig overridden = slack.with(
                token != null ? token : slack.botToken(),
                channel != null ? channel : slack.channel(),
                webhook != null ? webhook : slack.webhookUrl()
            );
            result = result.withNotification(new NotificationConfig(overridden));
        }
        return result;
    }

    private String env(String key) {
        String value = environment.get(key);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private void checkPercent(List<String> problems, String key, double value) {
        if (value <= 0 || value > 100) {
            problems.add(key + " must be within (0, 100]");
        }
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private CaretakerConfig readOverDefaults(Path configPath) throws IOException {
        JsonNode defaultsNode = mapper.valueToTree(CaretakerConfig.defaults());
        JsonNode existingNode = canonicalize(mapper.readTree(Files.readString(configPath)), CaretakerConfig.class);
        return mapper.treeToValue(deepMerge(defaultsNode, existingNode), CaretakerConfig.class);
    }

    /**
     * Renames {@link JsonAlias} keys (the snake_case spellings) to their record component names so
     * that file values land on the same keys as the serialized defaults. A canonical key wins over
     * an alias of the same component.
     */
    private JsonNode canonicalize(JsonNode node, Class<?> type) {
        if (node == null || !node.isObject() || !type.isRecord()) {
            return node;
        }
        Map<String, RecordComponent> byKey = new HashMap<>();
        for (RecordComponent component : type.getRecordComponents()) {
            JsonAlias alias = component.getAccessor().getAnnotation(JsonAlias.class);
            if (alias != null) {
                for (String name : alias.value()) {
                    byKey.put(name, component);
                }
            }
        }
        for (RecordComponent component : type.getRecordComponents()) {
            byKey.put(component.getName(), component);
        }

        ObjectNode aliased = mapper.createObjectNode();
        ObjectNode canonical = mapper.createObjectNode();
        node.fields().forEachRemaining(entry -> {
            RecordComponent component = byKey.get(entry.getKey());
            if (component == null) {
                canonical.set(entry.getKey(), entry.getValue());
                return;
            }
            JsonNode value = canonicalize(entry.getValue(), component.getType());
            if (component.getName().equals(entry.getKey())) {
                canonical.set(component.getName(), value);
            } else {
                aliased.set(component.getName(), value);
            }
        });
        aliased.setAll(canonical);
        return aliased;
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }
}
