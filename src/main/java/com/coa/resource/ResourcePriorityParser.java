package com.coa.resource;

import com.coa.diagnostics.Diagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses resource-priority strings such as {@code "포병대대(필수), 공격헬기(권장)"}
 * and scores required resources against available ones.
 * <p>
 * Parsing never throws: malformed tokens are skipped with a PARSE diagnostic.
 * Parsed strings are memoized in a bounded LRU cache; cached results are immutable.
 */
public class ResourcePriorityParser {

    private static final Logger log = LoggerFactory.getLogger(ResourcePriorityParser.class);

    /** Score used when requirements exist but no availability data was supplied. */
    public static final double UNKNOWN_AVAILABILITY_SCORE = 0.2;

    private static final Pattern TOKEN = Pattern.compile("^(.+?)\\s*\\((.*?)\\)\\s*$");
    private static final char SEPARATOR = ',';

    /** Default number of distinct raw strings kept in the memo cache. */
    public static final int DEFAULT_CACHE_SIZE = 1024;

    private final Map<String, ParsedRequirements> cache;

    public ResourcePriorityParser() {
        this(DEFAULT_CACHE_SIZE);
    }

    /**
     * @param maxCacheSize Maximum number of memoized strings; least recently used entries are evicted
     */
    public ResourcePriorityParser(int maxCacheSize) {
        if (maxCacheSize <= 0) {
            throw new IllegalArgumentException("maxCacheSize must be positive: " + maxCacheSize);
        }
        this.cache = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, ParsedRequirements> eldest) {
                return size() > maxCacheSize;
            }
        };
    }

    /**
     * Parse a raw priority string into requirements, dropping malformed tokens.
     *
     * @param raw Comma-separated {@code name(tier)} tokens
     * @return Valid requirements in input order (possibly empty)
     */
    public List<ResourceRequirement> parse(String raw) {
        return parseWithWarnings(raw).requirements();
    }

    /**
     * Parse a raw priority string, keeping a diagnostic for each skipped token.
     */
    public ParsedRequirements parseWithWarnings(String raw) {
        if (raw == null || raw.isBlank()) {
            return ParsedRequirements.EMPTY;
        }
        synchronized (cache) {
            ParsedRequirements cached = cache.get(raw);
            if (cached != null) {
                return cached;
            }
        }
        ParsedRequirements parsed = doParse(raw);
        synchronized (cache) {
            cache.putIfAbsent(raw, parsed);
        }
        return parsed;
    }

    /**
     * Number of memoized strings.
     */
    public int cacheSize() {
        synchronized (cache) {
            return cache.size();
        }
    }

    private ParsedRequirements doParse(String raw) {
        List<ResourceRequirement> requirements = new ArrayList<>();
        List<Diagnostic> warnings = new ArrayList<>();

        for (String item : raw.split(String.valueOf(SEPARATOR))) {
            String token = item.trim();
            if (token.isEmpty()) {
                continue;
            }

            Matcher matcher = TOKEN.matcher(token);
            if (!matcher.matches()) {
                warnings.add(Diagnostic.parse("malformed resource token",
                        "Missing '(tier)' in resource token '" + token + "'"));
                log.warn("Skipping resource token without tier: '{}'", token);
                continue;
            }

            String name = matcher.group(1).trim();
            String label = matcher.group(2).trim();
            if (name.isEmpty()) {
                warnings.add(Diagnostic.parse("malformed resource token",
                        "Empty resource name in token '" + token + "'"));
                log.warn("Skipping resource token with empty name: '{}'", token);
                continue;
            }

            PriorityTier tier = PriorityTier.fromLabel(label).orElse(null);
            if (tier == null) {
                warnings.add(Diagnostic.parse("unknown priority tier",
                        "Unknown tier '" + label + "' in resource token '" + token + "'"));
                log.warn("Skipping resource token with unknown tier '{}': '{}'", label, token);
                continue;
            }

            requirements.add(new ResourceRequirement(name, tier));
            log.debug("Parsed resource requirement: {} ({}, {})", name, tier, tier.weight());
        }

        return new ParsedRequirements(requirements, warnings);
    }

    /**
     * Weighted match score of required resources against available resources.
     *
     * @param required  Requirements of one COA
     * @param available Resources available in the situation
     * @return Score in [0,1]; 1.0 for no requirements, 0.2 when availability is unknown
     */
    public double matchScore(List<ResourceRequirement> required, List<AvailableResource> available) {
        return match(required, available).score();
    }

    /**
     * Weighted match with matched / missing detail.
     */
    public ResourceMatch match(List<ResourceRequirement> required, List<AvailableResource> available) {
        if (required == null || required.isEmpty()) {
            return ResourceMatch.unconstrained();
        }
        if (available == null || available.isEmpty()) {
            return new ResourceMatch(UNKNOWN_AVAILABILITY_SCORE, List.of(),
                    required.stream().map(ResourceRequirement::resource).toList(),
                    List.of(Diagnostic.dataGap("resource data unknown",
                            "No available-resource data; using fallback " + UNKNOWN_AVAILABILITY_SCORE)));
        }

        // Insertion order keeps the first registration of a name, so matching is deterministic
        Map<String, AvailableResource> byName = new LinkedHashMap<>();
        for (AvailableResource resource : available) {
            register(byName, resource.name(), resource);
            register(byName, resource.tacticalRole(), resource);
        }

        double totalWeight = 0.0;
        double matchedWeight = 0.0;
        List<String> matched = new ArrayList<>();
        List<String> missing = new ArrayList<>();

        for (ResourceRequirement requirement : required) {
            totalWeight += requirement.weight();
            AvailableResource candidate = findMatch(normalize(requirement.resource()), byName);

            if (candidate == null) {
                missing.add(requirement.resource());
            } else if (!candidate.usable()) {
                missing.add(requirement.resource() + " (unusable: operational=" + candidate.operational()
                        + ", quantity=" + candidate.quantity() + ")");
            } else {
                matchedWeight += requirement.weight();
                matched.add(requirement.resource());
            }
        }

        double score = totalWeight > 0 ? matchedWeight / totalWeight : 1.0;
        log.debug("Resource match {}/{} -> {}", matched.size(), required.size(), score);
        return new ResourceMatch(score, matched, missing, List.of());
    }

    private void register(Map<String, AvailableResource> byName, String name, AvailableResource resource) {
        String key = normalize(name);
        if (!key.isEmpty()) {
            byName.putIfAbsent(key, resource);
        }
    }

    private AvailableResource findMatch(String requiredName, Map<String, AvailableResource> byName) {
        if (requiredName.isEmpty()) {
            return null;
        }
        AvailableResource exact = byName.get(requiredName);
        if (exact != null) {
            return exact;
        }
        for (Map.Entry<String, AvailableResource> entry : byName.entrySet()) {
            String availableName = entry.getKey();
            if (availableName.contains(requiredName) || requiredName.contains(availableName)) {
                return entry.getValue();
            }
        }
        return null;
    }

    static String normalize(String name) {
        if (name == null) {
            return "";
        }
        return name.toLowerCase(Locale.ROOT)
                .replace(" ", "")
                .replace("-", "")
                .replace("_", "");
    }
}
