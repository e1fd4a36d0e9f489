package io.devguard.extract;

import io.devguard.model.UnparsedFile;

/**
 * Result of extracting one document: exactly one of the two components is set.
 */
public record ExtractionOutcome(FileContribution contribution, UnparsedFile unparsed) {

    public ExtractionOutcome {
        if ((contribution == null) == (unparsed == null)) {
            throw new IllegalArgumentException("exactly one of contribution and unparsed must be set");
        }
    }

    public static ExtractionOutcome parsed(FileContribution contribution) {
        return new ExtractionOutcome(contribution, null);
    }

    public static ExtractionOutcome failed(UnparsedFile unparsed) {
        return new ExtractionOutcome(null, unparsed);
    }

    public boolean isParsed() {
        return contribution != null;
    }

    public String path() {
        return isParsed() ? contribution.path() : unparsed.path();
    }
}
