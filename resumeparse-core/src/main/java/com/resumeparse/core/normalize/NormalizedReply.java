package com.resumeparse.core.normalize;

import com.resumeparse.core.model.CandidateRecord;
import lombok.Value;

import java.util.List;

/**
 * Records recovered from one reply. {@code parsed} is false when no JSON array or
 * object could be read from the reply at all.
 */
@Value
public class NormalizedReply {
    List<CandidateRecord> records;
    boolean parsed;
}
