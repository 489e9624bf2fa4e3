package com.agentrelay.orchestrator.quality;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lexical patterns shared by the analyzer and the dimension scorers.
 */
public final class QualityPatterns {

    private QualityPatterns() {}

    // ------------------------------------------------------------------
    // Negative signals
    // ------------------------------------------------------------------

    /** Filler phrases that carry no information. Matched case-insensitively. */
    public static final List<String> GENERIC_PHRASES = List.of(
            "generally speaking",
            "you might want to consider",
            "you may want to",
            "it depends",
            "in general",
            "as a general rule",
            "best practices",
            "it is important to",
            "there are many ways",
            "various factors",
            "it is recommended",
            "could potentially",
            "one could argue",
            "at the end of the day",
            "moving forward",
            "when possible",
            "as needed",
            "consider optimizing",
            "improve efficiency",
            "optimize performance");

    public static final Pattern HEDGE = Pattern.compile(
            "\\b(might|may|could|perhaps|possibly|consider|maybe|potentially|somewhat|probably)\\b",
            Pattern.CASE_INSENSITIVE);

    public static final Pattern VAGUE = Pattern.compile(
            "\\b(various|several|things|stuff|certain|appropriate|some|many|a lot)\\b",
            Pattern.CASE_INSENSITIVE);

    public static final Pattern ABSOLUTE_CLAIM = Pattern.compile(
            "\\b(guaranteed|guarantees?|always works|never fails|zero risk|perfect(ly)?|"
            + "eliminates? all|completely eliminates?|100% (accurate|certain|guaranteed|reliable))\\b",
            Pattern.CASE_INSENSITIVE);

    /** Figures with four or more decimals look invented more often than measured. */
    public static final Pattern OVERPRECISE_NUMBER = Pattern.compile("\\b\\d+\\.\\d{4,}\\b");

    /** Reductions above 100 % are impossible. */
    public static final Pattern IMPOSSIBLE_REDUCTION = Pattern.compile(
            "\\b(1\\d{2,}|[2-9]\\d{2,})(\\.\\d+)?\\s?%\\s*(reduction|decrease|less|lower|savings?)",
            Pattern.CASE_INSENSITIVE);

    public static final Pattern CAUSAL_SPLIT = Pattern.compile(
            "\\b(because|since|due to|as a result of)\\b", Pattern.CASE_INSENSITIVE);

    // ------------------------------------------------------------------
    // Positive signals
    // ------------------------------------------------------------------

    public static final Pattern NUMBER = Pattern.compile(
            "\\$?\\b\\d[\\d,]*(\\.\\d+)?");

    public static final Pattern UNIT_VALUE = Pattern.compile(
            "\\$\\s?\\d[\\d,]*(\\.\\d+)?[km]?"
            + "|\\b\\d[\\d,]*(\\.\\d+)?\\s?(%|(ms|s|sec|secs|seconds|minutes|min|mins|hours|hrs|days|weeks|"
            + "gb|mb|kb|tb|gib|mib|gbps|mbps|x|qps|rps|tps|tokens|requests|users|cores|gpus?|nodes|pp|"
            + "instances|replicas|rows|k|m)\\b)",
            Pattern.CASE_INSENSITIVE);

    public static final Pattern PERCENTAGE = Pattern.compile("\\b\\d+(\\.\\d+)?\\s?%");

    public static final Pattern CURRENCY = Pattern.compile("\\$\\s?\\d[\\d,]*(\\.\\d+)?");

    public static final Pattern COMPARISON = Pattern.compile(
            "\\bfrom\\s+\\$?\\d[\\d,.]*\\s?[a-z%]*\\s+to\\s+\\$?\\d"
            + "|\\d[\\d,.]*\\s?[a-z%]*\\s*(->|→)\\s*\\$?\\d"
            + "|\\bvs\\.?\\s"
            + "|\\b\\d+(\\.\\d+)?x\\s+(faster|slower|cheaper|more|less|smaller|larger)"
            + "|\\bby\\s+\\$?\\d[\\d,.]*\\s?%?",
            Pattern.CASE_INSENSITIVE);

    public static final Pattern ACTION_VERB = Pattern.compile(
            "\\b(?:(?:implement|deploy|configur|enabl|disabl|switch|migrat|remov|replac|"
            + "reduc|increas|decreas|upgrad|downgrad|scal|cach|batch|index|optimi[sz]|tune|tuning|monitor|"
            + "schedul|refactor|install|creat|updat|apply|appli|allocat|limit|partition|compress|"
            + "quantiz|shard|prun|rollback|verify|validat|measur|benchmark)\\w*"
            + "|use|uses|used|using|set|sets|run|runs|add|adds|added|roll out)\\b",
            Pattern.CASE_INSENSITIVE);

    public static final Pattern STEP_MARKER = Pattern.compile(
            "(?m)^\\s*(\\d+[.)]|[-*•])\\s+|\\bstep\\s+\\d+\\b|\\b(first|second|third|then|next|finally)\\b",
            Pattern.CASE_INSENSITIVE);

    public static final Pattern CODE_OR_COMMAND = Pattern.compile(
            "`[^`]+`|\\b(SELECT|CREATE|ALTER|UPDATE|kubectl|docker|pip|npm|mvn|curl|export)\\b"
            + "|--[a-z][a-z-]+|\\b\\w+\\(\\)|\\b[a-z_]+=[\\w.]+");

    public static final Pattern METHOD_CONNECTOR = Pattern.compile(
            "\\b(because|due to|by|using|via|through|since|so that|resulting in|which)\\b",
            Pattern.CASE_INSENSITIVE);

    public static final Pattern CONCLUSION = Pattern.compile(
            "\\b(indicates?|suggests?|shows?|therefore|thus|as a result|means)\\b",
            Pattern.CASE_INSENSITIVE);

    public static final Pattern RECOMMENDATION = Pattern.compile(
            "\\b(recommend\\w*|should|next steps?|propose\\w*|advise\\w*)\\b",
            Pattern.CASE_INSENSITIVE);

    public static final Set<String> TECHNICAL_TERMS = Set.of(
            "gpu", "cpu", "memory", "latency", "throughput", "cache", "index", "query", "database",
            "batch", "inference", "model", "kubernetes", "cluster", "container", "api", "endpoint",
            "bandwidth", "quantization", "checkpointing", "sharding", "replica", "thread", "pool",
            "queue", "token", "tokens", "embedding", "p95", "p99", "sql", "redis", "node", "instance",
            "storage", "network", "utilization", "b-tree", "vram", "disk", "iops", "cost", "budget",
            "workload", "pipeline", "schema", "partition");

    public static final Set<String> STOPWORDS = Set.of(
            "the", "a", "an", "and", "or", "but", "of", "to", "in", "on", "for", "with", "is", "are",
            "was", "were", "be", "been", "it", "this", "that", "these", "those", "as", "at", "by",
            "from", "we", "you", "our", "your", "can", "will", "would", "should", "i", "me", "my",
            "what", "how", "why", "when", "which", "do", "does", "did", "have", "has", "had", "not",
            "so", "if", "then", "than", "into", "about", "more", "most", "very", "also", "because",
            "since", "due");
}
