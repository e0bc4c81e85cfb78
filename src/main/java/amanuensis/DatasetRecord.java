package amanuensis;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import teihelper.AbbreviationOccurrence;
import teihelper.DocumentMetadata;

/**
 * One accepted expansion with its frozen context, as handed to dataset
 * consumers. Splitting and training formats are the consumer's business.
 */
@JsonPropertyOrder({"abbreviation", "expansion", "context_before", "context_after", "source", "metadata"})
public final class DatasetRecord {

    @JsonPropertyOrder({"file", "confidence", "source_type"})
    public static final class Source {
        @JsonProperty("file")
        public final String file;
        @JsonProperty("confidence")
        public final double confidence;
        @JsonProperty("source_type")
        public final SuggestionSource sourceType;

        Source(String file, double confidence, SuggestionSource sourceType) {
            this.file = file;
            this.confidence = confidence;
            this.sourceType = sourceType;
        }
    }

    @JsonProperty("abbreviation")
    public final String abbreviation;
    @JsonProperty("expansion")
    public final String expansion;
    @JsonProperty("context_before")
    public final String contextBefore;
    @JsonProperty("context_after")
    public final String contextAfter;
    @JsonProperty("source")
    public final Source source;
    @JsonProperty("metadata")
    public final DocumentMetadata metadata;

    private DatasetRecord(String abbreviation, String expansion, String contextBefore, String contextAfter,
                          Source source, DocumentMetadata metadata) {
        this.abbreviation = abbreviation;
        this.expansion = expansion;
        this.contextBefore = contextBefore;
        this.contextAfter = contextAfter;
        this.source = source;
        this.metadata = metadata;
    }

    /**
     * @param decision an {@link Decision.Kind#ACCEPT} decision
     */
    public static DatasetRecord of(AbbreviationOccurrence occurrence, Decision decision) {
        if (decision.getKind() != Decision.Kind.ACCEPT) {
            throw new IllegalArgumentException("Only accepted expansions become dataset records: " + decision);
        }
        return new DatasetRecord(occurrence.getKey(), decision.getExpansion(),
                occurrence.getContextBefore(), occurrence.getContextAfter(),
                new Source(occurrence.getFileName(), decision.getConfidence(), decision.getSource()),
                occurrence.getMetadata());
    }
}
