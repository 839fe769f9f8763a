package org.Aayush.navigation.data;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Encoding types a form submission may declare.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum FormEncType {
    URL_ENCODED("application/x-www-form-urlencoded"),
    MULTIPART("multipart/form-data");

    private final String mimeType;
}
