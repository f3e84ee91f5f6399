package com.minicall.recording;

import java.util.Map;

public interface ObjectStorage {

    /**
     * 上传对象。
     *
     * @return 可访问的对象 URL
     */
    String put(String key, byte[] bytes, String contentType, Map<String, String> metadata);
}
