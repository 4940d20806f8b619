package br.edu.ifba.journal.nlu;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import br.edu.ifba.journal.core.EntityType;
import br.edu.ifba.journal.core.ExtractedFact;
import br.edu.ifba.journal.core.ExtractedFact.Emotion;
import br.edu.ifba.journal.core.ExtractedFact.Mention;
import br.edu.ifba.journal.core.ExtractedFact.Relationship;
import br.edu.ifba.journal.core.IntentLabel;
import br.edu.ifba.journal.core.Valence;
import br.edu.ifba.journal.exception.SchemaValidationException;

/**
 * Recovers and validates the JSON answer of a generative extraction call.
 *
 * <h2>Recovery</h2>
 * <p>Models wrap JSON in markdown fences or chat around it. The first fenced block that parses
 * wins; otherwise the first balanced {@code {...}} object in the text; otherwise the first
 * balanced {@code [...]} array, of which the first object is used.</p>
 *
 * <h2>Validation</h2>
 * <p>Every problem found is collected, and any problem rejects the whole answer:</p>
 * <ul>
 *   <li>entity types must be one of the {@link EntityType} labels</li>
 *   <li>valence must be one of the {@link Valence} labels</li>
 *   <li>intensity must be an integer from 1 to 5</li>
 *   <li>relation types must be short labels</li>
 *   <li>intent must be one of the {@link IntentLabel} labels</li>
 * </ul>
 *
 * <p>When no relationships are returned but two or more entities are, {@code mentioned_with}
 * relationships are inferred from the first entity to each of the others.</p>
 */
public class ExtractionResponseParser {

    public static final String CO_OCCURRENCE = "mentioned_with";

    static final int MAX_RELATION_TYPE_LENGTH = 40;
    static final int MAX_RELATION_TYPE_WORDS = 5;

    private static final Pattern CODE_FENCE = Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)\\s*```");

    private final ObjectMapper objectMapper;

    public ExtractionResponseParser(@NotNull ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses and validates a raw model answer.
     *
     * @param raw the model output
     * @param extractedBy strategy name recorded on the result
     * @throws SchemaValidationException if no JSON object can be recovered or it breaks the schema
     */
    @NotNull
    public ExtractedFact parse(@Nullable String raw, @NotNull String extractedBy) {
        if (raw == null || raw.isBlank()) {
            throw new SchemaValidationException("Empty extraction answer", List.of("answer was empty"));
        }

        JsonNode root = recoverObject(raw)
            .orElseThrow(() -> new SchemaValidationException(
                "No JSON object in extraction answer", List.of("answer did not contain a JSON object")));

        List<String> problems = new ArrayList<>();
        List<Mention> entities = readEntities(root.get("entities"), problems);
        List<Emotion> emotions = readEmotions(root.get("emotions"), problems);
        List<Relationship> relationships = readRelationships(root.get("relationships"), problems);
        IntentLabel intent = readIntent(root.get("intent"), problems);

        if (!problems.isEmpty()) {
            throw new SchemaValidationException("Extraction answer failed validation", problems);
        }

        if (relationships.isEmpty() && entities.size() >= 2) {
            relationships = inferCoOccurrence(entities);
        }

        return new ExtractedFact(entities, emotions, relationships, intent, extractedBy);
    }

    /**
     * Finds the JSON object in a model answer.
     */
    @NotNull
    Optional<JsonNode> recoverObject(@NotNull String raw) {
        String text = raw.strip();

        Matcher fence = CODE_FENCE.matcher(text);
        if (fence.find()) {
            Optional<JsonNode> fenced = readObject(fence.group(1).strip());
            if (fenced.isPresent()) {
                return fenced;
            }
        }

        String object = balancedSpan(text, '{', '}');
        if (object != null) {
            Optional<JsonNode> parsed = readObject(object);
            if (parsed.isPresent()) {
                return parsed;
            }
        }

        String array = balancedSpan(text, '[', ']');
        if (array != null) {
            return readObject(array);
        }
        return Optional.empty();
    }

    /**
     * First balanced span from {@code open} to its matching {@code close}, ignoring brackets
     * inside JSON strings.
     */
    @Nullable
    static String balancedSpan(@NotNull String text, char open, char close) {
        int start = text.indexOf(open);
        if (start < 0) {
            return null;
        }

        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (escaped) {
                escaped = false;
                continue;
            }
            if (c == '\\') {
                escaped = true;
                continue;
            }
            if (c == '"') {
                inString = !inString;
                continue;
            }
            if (!inString) {
                if (c == open) {
                    depth++;
                } else if (c == close) {
                    depth--;
                    if (depth == 0) {
                        return text.substring(start, i + 1);
                    }
                }
            }
        }
        return null;
    }

    private Optional<JsonNode> readObject(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node != null && node.isArray()) {
                node = node.size() > 0 ? node.get(0) : null;
            }
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    private List<Mention> readEntities(JsonNode node, List<String> problems) {
        List<Mention> entities = new ArrayList<>();
        for (JsonNode item : items(node, "entities", problems)) {
            String name = text(item, "name");
            if (name == null) {
                problems.add("entity without name");
                continue;
            }
            String type = text(item, "type");
            Optional<EntityType> entityType = EntityType.fromLabel(type);
            if (entityType.isEmpty()) {
                problems.add("entity '" + name + "' has unknown type '" + type + "'");
                continue;
            }
            entities.add(new Mention(name, entityType.get()));
        }
        return entities;
    }

    private List<Emotion> readEmotions(JsonNode node, List<String> problems) {
        List<Emotion> emotions = new ArrayList<>();
        for (JsonNode item : items(node, "emotions", problems)) {
            String name = text(item, "name");
            if (name == null) {
                // older prompt wording used "type" for the emotion word
                name = text(item, "type");
            }
            if (name == null) {
                problems.add("emotion without name");
                continue;
            }

            String valenceLabel = text(item, "valence");
            Optional<Valence> valence = Valence.fromLabel(valenceLabel);
            if (valence.isEmpty()) {
                problems.add("emotion '" + name + "' has invalid valence '" + valenceLabel + "'");
                continue;
            }

            JsonNode intensity = item.get("intensity");
            if (intensity == null || !intensity.isIntegralNumber()) {
                problems.add("emotion '" + name + "' intensity is not an integer");
                continue;
            }
            int value = intensity.intValue();
            if (value < Emotion.MIN_INTENSITY || value > Emotion.MAX_INTENSITY) {
                problems.add("emotion '" + name + "' intensity " + value + " outside 1..5");
                continue;
            }
            emotions.add(new Emotion(name, valence.get(), value));
        }
        return emotions;
    }

    private List<Relationship> readRelationships(JsonNode node, List<String> problems) {
        List<Relationship> relationships = new ArrayList<>();
        for (JsonNode item : items(node, "relationships", problems)) {
            String source = text(item, "source");
            String target = text(item, "target");
            String type = text(item, "type");
            if (source == null || target == null || type == null) {
                problems.add("relationship missing source, target or type");
                continue;
            }
            if (type.length() > MAX_RELATION_TYPE_LENGTH || type.split("\\s+").length > MAX_RELATION_TYPE_WORDS) {
                problems.add("relationship type '" + type + "' is not a short label");
                continue;
            }
            relationships.add(new Relationship(source, target, type));
        }
        return relationships;
    }

    private IntentLabel readIntent(JsonNode node, List<String> problems) {
        String label = node != null && node.isTextual() ? node.asText() : null;
        Optional<IntentLabel> intent = IntentLabel.fromLabel(label);
        if (intent.isEmpty()) {
            problems.add("intent '" + label + "' is not one of the five labels");
            return IntentLabel.GENERAL;
        }
        return intent.get();
    }

    private Iterable<JsonNode> items(JsonNode node, String field, List<String> problems) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            problems.add("'" + field + "' is not an array");
            return List.of();
        }
        List<JsonNode> objects = new ArrayList<>();
        for (JsonNode item : node) {
            if (item.isObject()) {
                objects.add(item);
            } else {
                problems.add("'" + field + "' contains a non-object element");
            }
        }
        return objects;
    }

    @Nullable
    private static String text(JsonNode item, String field) {
        JsonNode value = item.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            return null;
        }
        return value.asText().trim();
    }

    private static List<Relationship> inferCoOccurrence(List<Mention> entities) {
        String first = entities.get(0).name();
        List<Relationship> inferred = new ArrayList<>(entities.size() - 1);
        for (int i = 1; i < entities.size(); i++) {
            String other = entities.get(i).name();
            if (!other.equalsIgnoreCase(first)) {
                inferred.add(new Relationship(first, other, CO_OCCURRENCE));
            }
        }
        return inferred;
    }
}
