package com.payments.controls.loader;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.payments.controls.domain.Control;
import com.payments.controls.domain.ControlAction;
import com.payments.controls.domain.Rail;
import com.payments.controls.util.AlertLogger;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Loads the control set from its YAML definition.
 * <p>
 * The document is a sequence of control records:
 * <pre>
 * - control_id: ACH_INSTANT_HIGH_AMOUNT_NEW_ACCOUNT
 *   rail: ACH
 *   severity: HIGH
 *   action: BLOCK
 *   description: Instant ACH over 5000 from an account younger than 30 days
 *   conditions:
 *     funding_speed: instant
 *     amount_gt: 5000
 *     account_age_lt_days: 30
 * </pre>
 * Controls keep their declaration order.
 */
@ApplicationScoped
public class ControlsLoader {

    private static final Logger LOG = Logger.getLogger(ControlsLoader.class);

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    /**
     * Loads and resolves the control set in a file.
     *
     * @throws ControlsLoadException if the file is missing, unreadable or malformed
     */
    public List<Control> load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ControlsLoadException("Controls file not found: " + path);
        }
        String yaml;
        try {
            yaml = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ControlsLoadException("Failed to read controls file " + path + ": " + e.getMessage(), e);
        }
        List<Control> controls = parse(yaml, path.toString());
        LOG.infof("Loaded %d controls from %s", controls.size(), path);
        return controls;
    }

    /**
     * Parses a control set document.
     *
     * @param yaml   the YAML text
     * @param source where the text came from, used in messages
     */
    public List<Control> parse(String yaml, String source) {
        JsonNode root;
        try {
            root = yamlMapper.readTree(yaml);
        } catch (JsonProcessingException e) {
            throw new ControlsLoadException("Malformed controls file " + source + ": " + e.getOriginalMessage(), e);
        }

        if (root == null || root.isNull() || root.isMissingNode()) {
            LOG.warnf("Controls file %s is empty, no controls will run", source);
            return List.of();
        }
        if (!root.isArray()) {
            throw new ControlsLoadException("Controls file " + source + " must contain a sequence of controls");
        }

        List<Control> controls = new ArrayList<>(root.size());
        Set<String> seenIds = new HashSet<>();
        int position = 0;
        for (JsonNode controlNode : root) {
            position++;
            Control control = parseControl(controlNode, position, source);
            if (!seenIds.add(control.getControlId())) {
                AlertLogger.duplicateControlId(control.getControlId(), source);
            }
            controls.add(control);
        }
        return controls;
    }

    private Control parseControl(JsonNode node, int position, String source) {
        if (node == null || !node.isObject()) {
            throw new ControlsLoadException("Control #" + position + " in " + source + " is not a mapping");
        }

        String controlId = readScalar(node, "control_id");
        if (controlId == null || controlId.isBlank()) {
            throw new ControlsLoadException("Control #" + position + " in " + source + " is missing control_id");
        }

        String railValue = readScalar(node, "rail");
        if (railValue == null) {
            throw new ControlsLoadException("Control " + controlId + " in " + source + " is missing rail");
        }
        Rail rail = Rail.fromString(railValue);
        if (rail == null) {
            throw new ControlsLoadException("Control " + controlId + " in " + source
                    + " has unknown rail '" + railValue + "'");
        }

        String severity = readScalar(node, "severity");
        String action = normalize(readScalar(node, "action"));
        if (action != null && ControlAction.fromString(action) == null) {
            LOG.warnf("Control %s declares unrecognized action '%s'; it ranks lowest in resolution",
                    controlId, action);
        }
        String description = readScalar(node, "description");
        Map<String, Object> conditions = readConditions(node.get("conditions"), controlId, source);

        try {
            return new Control(controlId, rail, severity, action, description, conditions);
        } catch (IllegalArgumentException e) {
            throw new ControlsLoadException("Control " + controlId + " in " + source
                    + " has an invalid condition: " + e.getMessage(), e);
        }
    }

    private Map<String, Object> readConditions(JsonNode node, String controlId, String source) {
        Map<String, Object> conditions = new LinkedHashMap<>();
        if (node == null || node.isNull()) {
            return conditions;
        }
        if (!node.isObject()) {
            throw new ControlsLoadException("Control " + controlId + " in " + source
                    + " has conditions that are not a mapping");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            conditions.put(entry.getKey(), toValue(entry.getValue()));
        }
        return conditions;
    }

    private Object toValue(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        return yamlMapper.convertValue(node, Object.class);
    }

    private String readScalar(JsonNode node, String name) {
        JsonNode value = node.get(name);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }

    private static String normalize(String value) {
        return value != null ? value.trim().toUpperCase(Locale.ROOT) : null;
    }
}
