package com.polyagent.orchestration.service;

import com.polyagent.config.PolyAgentProperties;
import com.polyagent.config.PolyAgentProperties.ScoringHeuristic;
import com.polyagent.orchestration.model.AgentContribution;
import com.polyagent.orchestration.model.EmergentPattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Text heuristics shared by the paradigms: keyword extraction, shared-theme detection and output scoring.
 */
@Service
@RequiredArgsConstructor
public class ResponseAnalysisService {

    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final Set<String> STOPWORDS = Set.of(
            "about", "above", "after", "again", "also", "because", "been", "before", "being", "between",
            "both", "but", "could", "does", "doing", "each", "even", "from", "further", "have", "here",
            "into", "just", "like", "make", "more", "most", "much", "must", "need", "only", "other",
            "over", "same", "should", "some", "such", "than", "that", "their", "them", "then", "there",
            "these", "they", "this", "those", "through", "under", "until", "very", "want", "well",
            "were", "what", "when", "where", "which", "while", "will", "with", "would", "your");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int THEME_PREVIEW_LENGTH = 80;

    private final PolyAgentProperties properties;

    public List<String> tokens(String text) {
        if (!StringUtils.hasText(text)) {
            return List.of();
        }
        return Arrays.stream(TOKEN_SPLIT.split(text.toLowerCase(Locale.ROOT)))
                .filter(StringUtils::hasText)
                .toList();
    }

    public Set<String> keywords(String text) {
        int minLength = properties.getParadigms().getSwarmMinKeywordLength();
        Set<String> keywords = new LinkedHashSet<>();
        for (String token : tokens(text)) {
            if (token.length() >= minLength && !STOPWORDS.contains(token)) {
                keywords.add(token);
            }
        }
        return keywords;
    }

    /**
     * Themes shared by at least two agents, most widely shared first. A response repeated verbatim
     * (ignoring case and whitespace) is a theme of its own, followed by keywords found in several responses.
     */
    public List<EmergentPattern> sharedThemes(List<AgentContribution> contributions) {
        if (contributions == null || contributions.size() < 2) {
            return List.of();
        }
        Map<String, List<String>> agentsByResponse = new LinkedHashMap<>();
        Map<String, List<String>> agentsByKeyword = new LinkedHashMap<>();
        for (AgentContribution contribution : contributions) {
            String normalized = normalize(contribution.response());
            if (!normalized.isEmpty()) {
                addAgent(agentsByResponse, normalized, contribution.agentId());
            }
            for (String keyword : keywords(contribution.response())) {
                addAgent(agentsByKeyword, keyword, contribution.agentId());
            }
        }
        List<EmergentPattern> patterns = new ArrayList<>();
        patterns.addAll(shared(agentsByResponse, true));
        patterns.addAll(shared(agentsByKeyword, false));
        return patterns.stream()
                .limit(properties.getParadigms().getSwarmMaxPatterns())
                .toList();
    }

    private List<EmergentPattern> shared(Map<String, List<String>> agentsByTheme, boolean preview) {
        return agentsByTheme.entrySet().stream()
                .filter(entry -> entry.getValue().size() >= 2)
                .map(entry -> new EmergentPattern(preview ? preview(entry.getKey()) : entry.getKey(),
                        List.copyOf(entry.getValue())))
                .sorted(Comparator.comparingInt(EmergentPattern::support).reversed())
                .toList();
    }

    private static void addAgent(Map<String, List<String>> agentsByTheme, String theme, String agentId) {
        List<String> agents = agentsByTheme.computeIfAbsent(theme, key -> new ArrayList<>());
        if (!agents.contains(agentId)) {
            agents.add(agentId);
        }
    }

    private static String normalize(String text) {
        if (!StringUtils.hasText(text)) {
            return "";
        }
        return WHITESPACE.matcher(text.trim().toLowerCase(Locale.ROOT)).replaceAll(" ");
    }

    private static String preview(String text) {
        return text.length() <= THEME_PREVIEW_LENGTH ? text : text.substring(0, THEME_PREVIEW_LENGTH) + "...";
    }

    /**
     * LENGTH scores by character count. KEYWORD_DENSITY scores the share of words that hit a task keyword,
     * falling back to the share of distinct keywords when the task has none.
     */
    public double score(String output, String task) {
        ScoringHeuristic heuristic = properties.getParadigms().getEcosystemScoring();
        if (!StringUtils.hasText(output)) {
            return 0.0;
        }
        if (heuristic == ScoringHeuristic.LENGTH) {
            return output.length();
        }
        List<String> words = tokens(output);
        if (words.isEmpty()) {
            return 0.0;
        }
        Set<String> taskKeywords = keywords(task);
        if (taskKeywords.isEmpty()) {
            return (double) keywords(output).size() / words.size();
        }
        long hits = words.stream().filter(taskKeywords::contains).count();
        return (double) hits / words.size();
    }
}
