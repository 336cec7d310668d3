package com.example.diversifier.model;

import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Synthetic preference signal derived from one category matched in a past turn.
 */
@Value
@AllArgsConstructor
public class PseudoEvent {
    String categoryLabel;
    int sourceTurnNumber;
}
