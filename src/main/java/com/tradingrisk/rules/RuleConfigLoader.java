package com.tradingrisk.rules;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.tradingrisk.exception.ConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

/**
 * Reads the YAML rule file and builds a validated {@link RuleConfig}.
 *
 * <p>All structural checks happen here, once, so the scoring path never has to re-validate:
 * <ul>
 *   <li>scale and number questions need {@code min < max}</li>
 *   <li>question and category weights must be non-negative</li>
 *   <li>{@code no_trade} must be below {@code risk_2_percent}</li>
 *   <li>{@code min_lot_size} must not exceed {@code max_lot_size}; pip values must be positive</li>
 *   <li>question ids must be unique across categories</li>
 * </ul>
 * Any violation aborts startup with a {@link ConfigurationException}.
 */
@Component
public class RuleConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(RuleConfigLoader.class);

    private static final double DEFAULT_SCALE_MIN = 1;
    private static final double DEFAULT_SCALE_MAX = 5;

    private final ResourceLoader resourceLoader;
    private final YAMLMapper yamlMapper = new YAMLMapper();

    public RuleConfigLoader(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    /**
     * Loads and validates the rule file at the given resource location.
     *
     * @throws ConfigurationException if the file is missing, unreadable, or invalid
     */
    public RuleConfig load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new ConfigurationException("Rule file not found: " + location);
        }

        JsonNode root;
        try (InputStream inputStream = resource.getInputStream()) {
            root = yamlMapper.readTree(inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to parse rule file " + location + ": " + e.getMessage(), e);
        }

        RuleConfig ruleConfig = build(new RuleDocument(root, location));
        log.info(
                "Loaded rule set from {}: {} categories, {} questions",
                location,
                ruleConfig.getCategories().size(),
                ruleConfig.getQuestionsByCategory().values().stream()
                        .mapToInt(List::size)
                        .sum());
        return ruleConfig;
    }

    /** Builds a rule set from an already parsed document. */
    public RuleConfig build(RuleDocument document) {
        HardStopThresholds hardStops = readHardStops(document);
        List<String> categories = readCategories(document);
        Map<String, List<QuestionSpec>> questions = readQuestions(document, categories, hardStops);

        return new RuleConfig(
                hardStops,
                categories,
                questions,
                readCategoryWeights(document),
                readScoreThresholds(document),
                readLotSizing(document),
                readCoach(document));
    }

    private HardStopThresholds readHardStops(RuleDocument document) {
        List<String> checks = document.optionalList("hard_stops", "checks").stream()
                .map(JsonNode::asText)
                .collect(Collectors.toList());

        return HardStopThresholds.builder()
                .maxConsecutiveLosses(document.requireInt("hard_stops", "max_consecutive_losses"))
                .maxDailyLossPercent(document.requireDouble("hard_stops", "max_daily_loss_percent"))
                .minSleepHours(document.requireDouble("hard_stops", "min_sleep_hours"))
                .psychologyMinScore(document.requireDouble("hard_stops", "psychology_min_score"))
                .requireClearBias(document.optionalBoolean(false, "hard_stops", "require_clear_bias"))
                .sleepQuestionId(document.optionalText("sleep_quality", "hard_stops", "sleep_question"))
                .mentalStateQuestionId(document.optionalText("mental_state", "hard_stops", "mental_state_question"))
                .clearBiasQuestionId(document.optionalText("clear_bias", "hard_stops", "clear_bias_question"))
                .enabledChecks(List.copyOf(checks))
                .build();
    }

    private List<String> readCategories(RuleDocument document) {
        List<JsonNode> configured = document.optionalList("scoring", "categories");
        if (configured.isEmpty()) {
            return RuleConfig.DEFAULT_CATEGORIES;
        }
        return configured.stream().map(JsonNode::asText).collect(Collectors.toList());
    }

    private Map<String, List<QuestionSpec>> readQuestions(
            RuleDocument document, List<String> categories, HardStopThresholds hardStops) {
        document.require("questions");
        Map<String, List<QuestionSpec>> questionsByCategory = new LinkedHashMap<>();
        Set<String> seenIds = new HashSet<>();

        for (String category : categories) {
            List<JsonNode> items = document.optionalList("questions", category);
            List<QuestionSpec> specs = new ArrayList<>();
            for (int i = 0; i < items.size(); i++) {
                String itemSource = document.getSource() + " questions." + category + "[" + i + "]";
                QuestionSpec spec = readQuestion(new RuleDocument(items.get(i), itemSource), category, hardStops);
                if (!seenIds.add(spec.getId())) {
                    throw new ConfigurationException("Duplicate question id '" + spec.getId() + "' in " + itemSource);
                }
                specs.add(spec);
            }
            questionsByCategory.put(category, specs);
        }
        return questionsByCategory;
    }

    private QuestionSpec readQuestion(RuleDocument item, String category, HardStopThresholds hardStops) {
        String id = item.requireText("id");
        QuestionKind kind = QuestionKind.fromConfig(item.optionalText("boolean", "type"));
        double weight = item.optionalDouble(1.0, "weight");
        if (weight < 0) {
            throw new ConfigurationException("Question '" + id + "' has negative weight " + weight);
        }

        QuestionSpec.QuestionSpecBuilder builder = QuestionSpec.builder()
                .id(id)
                .text(item.requireText("question"))
                .category(category)
                .kind(kind)
                .weight(weight)
                .reverseScore(item.optionalBoolean(false, "reverse_score"));

        if (kind.isRanged()) {
            double min = kind == QuestionKind.SCALE ? item.optionalDouble(DEFAULT_SCALE_MIN, "min") : item.requireDouble("min");
            double max = kind == QuestionKind.SCALE ? item.optionalDouble(DEFAULT_SCALE_MAX, "max") : item.requireDouble("max");
            if (!(min < max)) {
                throw new ConfigurationException(
                        "Question '" + id + "' needs min < max, got min=" + min + ", max=" + max);
            }
            builder.min(min).max(max);
        }

        if (kind == QuestionKind.NUMBER) {
            builder.steps(readSteps(item, id, hardStops));
        }
        return builder.build();
    }

    private List<ScoreStep> readSteps(RuleDocument item, String id, HardStopThresholds hardStops) {
        List<JsonNode> configured = item.optionalList("steps");
        if (configured.isEmpty()) {
            if (id.equals(hardStops.getSleepQuestionId())) {
                return ScoreStep.DEFAULT_SLEEP_CURVE;
            }
            log.warn("Number question '{}' declares no score steps; its answers will score 0", id);
            return List.of();
        }

        List<ScoreStep> steps = new ArrayList<>();
        for (int i = 0; i < configured.size(); i++) {
            RuleDocument step = new RuleDocument(configured.get(i), item.getSource() + ".steps[" + i + "]");
            double score = step.requireDouble("score");
            if (score < 0 || score > 100) {
                throw new ConfigurationException("Step score for '" + id + "' must be within [0, 100], got " + score);
            }
            steps.add(new ScoreStep(step.requireDouble("at"), score));
        }
        steps.sort(Comparator.comparingDouble(ScoreStep::getAt).reversed());
        return steps;
    }

    private Map<String, Double> readCategoryWeights(RuleDocument document) {
        Map<String, Double> weights = new LinkedHashMap<>();
        document.optionalMap("scoring", "weights").forEach((category, node) -> {
            if (!node.isNumber() || node.doubleValue() < 0) {
                throw new ConfigurationException(
                        "Category weight for '" + category + "' must be a non-negative number, got " + node);
            }
            weights.put(category, node.doubleValue());
        });
        return weights;
    }

    private ScoreThresholds readScoreThresholds(RuleDocument document) {
        double noTrade =
                document.optionalDouble(ScoreThresholds.DEFAULT_NO_TRADE, "scoring", "thresholds", "no_trade");
        double risk2Percent = document.optionalDouble(
                ScoreThresholds.DEFAULT_RISK_2_PERCENT, "scoring", "thresholds", "risk_2_percent");
        if (!(noTrade < risk2Percent)) {
            throw new ConfigurationException(
                    "scoring.thresholds.no_trade (" + noTrade + ") must be below risk_2_percent (" + risk2Percent + ")");
        }
        return new ScoreThresholds(noTrade, risk2Percent);
    }

    private LotSizingRules readLotSizing(RuleDocument document) {
        Map<String, BigDecimal> pipValues = new LinkedHashMap<>();
        document.optionalMap("lot_calculation", "pip_values").forEach((instrument, node) -> {
            if (!node.isNumber() || node.doubleValue() <= 0) {
                throw new ConfigurationException(
                        "Pip value for '" + instrument + "' must be a positive number, got " + node);
            }
            pipValues.put(instrument.toUpperCase(Locale.ROOT), node.decimalValue());
        });

        BigDecimal minLot = BigDecimal.valueOf(document.optionalDouble(
                LotSizingRules.DEFAULT_MIN_LOT.doubleValue(), "lot_calculation", "min_lot_size"));
        BigDecimal maxLot = BigDecimal.valueOf(document.optionalDouble(
                LotSizingRules.DEFAULT_MAX_LOT.doubleValue(), "lot_calculation", "max_lot_size"));
        if (minLot.compareTo(maxLot) > 0) {
            throw new ConfigurationException(
                    "lot_calculation.min_lot_size (" + minLot + ") exceeds max_lot_size (" + maxLot + ")");
        }

        return LotSizingRules.builder()
                .pipValues(Map.copyOf(pipValues))
                .minLotSize(minLot)
                .maxLotSize(maxLot)
                .build();
    }

    private CoachSettings readCoach(RuleDocument document) {
        List<String> messages = document.optionalList("coach", "motivational_messages").stream()
                .map(JsonNode::asText)
                .collect(Collectors.toList());
        return new CoachSettings(
                document.optionalInt(CoachSettings.DEFAULT_DAYS_INACTIVE_WARNING, "coach", "days_inactive_warning"),
                List.copyOf(messages));
    }
}
