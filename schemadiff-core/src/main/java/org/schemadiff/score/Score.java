package org.schemadiff.score;

public record Score(int value, boolean compatible, int breaking, int warnings, int infos) {
}
