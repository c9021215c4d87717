package com.dingdangmaoup.contentpool.model;

public enum GameType {
    GENERALS,
    ZERO_HOUR,
    UNKNOWN
}
