package com.scholary.vocalization.api;

import java.util.List;

/**
 * Supported upload formats.
 *
 * @param formats file extensions
 * @param contentTypes matching MIME types, same order
 */
public record FormatsResponse(List<String> formats, List<String> contentTypes) {}
