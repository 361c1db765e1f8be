package com.imagesearch.matching;

import lombok.Value;

/**
 * A source descriptor paired with its nearest candidate descriptor.
 */
@Value
public class Correspondence {
    int sourceIndex;
    int candidateIndex;
    float distance;
}
