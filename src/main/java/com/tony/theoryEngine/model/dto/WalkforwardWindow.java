package com.tony.theoryEngine.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WalkforwardWindow {
    public static final int MIN_TRAIN_DAYS = 30;
    public static final int MAX_TRAIN_DAYS = 730;
    public static final int MIN_TEST_DAYS = 3;
    public static final int MAX_TEST_DAYS = 90;

    @Builder.Default
    private int trainDays = 180;
    @Builder.Default
    private int testDays = 14;
    @Builder.Default
    private int stepDays = 7;
}
