package com.petmind.memory;

public record SweepResult(int kept, int archived, int dropped) {

    static final SweepResult EMPTY = new SweepResult(0, 0, 0);
}
