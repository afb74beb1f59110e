package com.mts.master;

/**
 * Master 生命周期状态：STOPPED -> INITIALIZED -> RUNNING -> STOPPED。
 */
public enum MasterState {
    STOPPED,
    INITIALIZED,
    RUNNING;

    public boolean canTransitionTo(MasterState target) {
        switch (this) {
            case STOPPED:
                return target == INITIALIZED;
            case INITIALIZED:
                return target == RUNNING || target == STOPPED;
            case RUNNING:
                return target == STOPPED;
            default:
                return false;
        }
    }
}
