package com.resumeparse.core.model;

import lombok.Value;

/**
 * What a record sink receives: one result position with the file it came from.
 */
@Value
public class ExtractedCandidate {
    int index;
    String filename;
    CandidateRecord record;
    Outcome outcome;
}
