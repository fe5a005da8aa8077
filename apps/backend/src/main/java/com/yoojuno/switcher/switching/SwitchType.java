package com.yoojuno.switcher.switching;

/**
 * Scene the production controller should switch to.
 */
public enum SwitchType {
    OFFLINE,
    PREVIOUS,
    LOW,
    NORMAL
}
