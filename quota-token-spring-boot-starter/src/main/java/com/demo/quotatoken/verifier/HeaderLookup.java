package com.demo.quotatoken.verifier;

import java.util.Map;
import java.util.TreeMap;

/**
 * 请求头读取，名称大小写不敏感。
 */
@FunctionalInterface
public interface HeaderLookup {

    String get(String name);

    static HeaderLookup of(Map<String, String> headers) {
        if (headers == null || headers.isEmpty()) {
            return name -> null;
        }
        Map<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        copy.putAll(headers);
        return copy::get;
    }
}
