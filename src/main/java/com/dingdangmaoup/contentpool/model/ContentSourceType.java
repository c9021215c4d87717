package com.dingdangmaoup.contentpool.model;

/**
 * Where the bytes of a manifest file come from
 */
public enum ContentSourceType {
    UNKNOWN,
    CONTENT_ADDRESSABLE,
    REMOTE_DOWNLOAD,
    GAME_INSTALLATION,
    EXTRACTED_PACKAGE,
    PATCH_FILE,
    LOCAL_FILE
}
