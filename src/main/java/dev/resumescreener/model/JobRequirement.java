package dev.resumescreener.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Set;

/**
 * A single skill requirement extracted from a job description.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class JobRequirement {
    String skillName;
    Importance importance;
    double minYears;
    @Singular
    Set<String> nameVariants;
}
