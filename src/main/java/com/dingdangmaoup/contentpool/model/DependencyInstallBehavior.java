package com.dingdangmaoup.contentpool.model;

public enum DependencyInstallBehavior {
    REQUIRE_EXISTING,
    AUTO_INSTALL,
    SUGGEST,
    OPTIONAL
}
