package com.imagesearch.feature;

import lombok.Value;

/**
 * A detected image location. Coordinates are in pixels of the original image.
 */
@Value
public class Keypoint {
    float x;
    float y;
    float size;     // diameter of the meaningful neighbourhood
    float angle;    // degrees, 0-360
    float response;
    int octave;
}
