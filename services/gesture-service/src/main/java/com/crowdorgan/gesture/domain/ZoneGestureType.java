package com.crowdorgan.gesture.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Zone gesture vocabulary.
 *
 * <p>Row sweeps are declared in row order (top to bottom) and column sweeps in column order
 * (left to right), which {@link #rowSweep(boolean, int)} and {@link #columnSweep(boolean, int)}
 * rely on.
 */
@Getter
@RequiredArgsConstructor
public enum ZoneGestureType {
    SWEEP_LR_TOP("sweep_lr_top"),
    SWEEP_LR_UPPER_MID("sweep_lr_upper_mid"),
    SWEEP_LR_LOWER_MID("sweep_lr_lower_mid"),
    SWEEP_LR_BOTTOM("sweep_lr_bottom"),

    SWEEP_RL_TOP("sweep_rl_top"),
    SWEEP_RL_UPPER_MID("sweep_rl_upper_mid"),
    SWEEP_RL_LOWER_MID("sweep_rl_lower_mid"),
    SWEEP_RL_BOTTOM("sweep_rl_bottom"),

    SWEEP_TB_LEFT("sweep_tb_left"),
    SWEEP_TB_MID_LEFT("sweep_tb_mid_left"),
    SWEEP_TB_MID_RIGHT("sweep_tb_mid_right"),
    SWEEP_TB_RIGHT("sweep_tb_right"),

    SWEEP_BT_LEFT("sweep_bt_left"),
    SWEEP_BT_MID_LEFT("sweep_bt_mid_left"),
    SWEEP_BT_MID_RIGHT("sweep_bt_mid_right"),
    SWEEP_BT_RIGHT("sweep_bt_right"),

    PULSE_ZONE("pulse_zone");

    private static final ZoneGestureType[] LEFT_TO_RIGHT = {
        SWEEP_LR_TOP, SWEEP_LR_UPPER_MID, SWEEP_LR_LOWER_MID, SWEEP_LR_BOTTOM
    };
    private static final ZoneGestureType[] RIGHT_TO_LEFT = {
        SWEEP_RL_TOP, SWEEP_RL_UPPER_MID, SWEEP_RL_LOWER_MID, SWEEP_RL_BOTTOM
    };
    private static final ZoneGestureType[] TOP_TO_BOTTOM = {
        SWEEP_TB_LEFT, SWEEP_TB_MID_LEFT, SWEEP_TB_MID_RIGHT, SWEEP_TB_RIGHT
    };
    private static final ZoneGestureType[] BOTTOM_TO_TOP = {
        SWEEP_BT_LEFT, SWEEP_BT_MID_LEFT, SWEEP_BT_MID_RIGHT, SWEEP_BT_RIGHT
    };

    private final String tag;

    public static ZoneGestureType rowSweep(boolean leftToRight, int row) {
        return leftToRight ? LEFT_TO_RIGHT[row] : RIGHT_TO_LEFT[row];
    }

    public static ZoneGestureType columnSweep(boolean topToBottom, int column) {
        return topToBottom ? TOP_TO_BOTTOM[column] : BOTTOM_TO_TOP[column];
    }
}
