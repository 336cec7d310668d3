package com.example.diversifier.model;

import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(staticName = "of")
public class Candidate {
    String id;
    boolean available;
}
