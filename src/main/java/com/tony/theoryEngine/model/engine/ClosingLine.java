package com.tony.theoryEngine.model.engine;

public record ClosingLine(String marketType, String side, Double line, Double price, String book) {
}
