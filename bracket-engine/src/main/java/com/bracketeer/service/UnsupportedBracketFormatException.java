package com.bracketeer.service;

import lombok.Getter;

import java.util.List;

@Getter
public class UnsupportedBracketFormatException extends RuntimeException {

    private final String requestedFormat;
    private final List<String> supportedFormats;

    public UnsupportedBracketFormatException(String requestedFormat, List<String> supportedFormats) {
        super("Unsupported bracket format '"
                + requestedFormat
                + "'. Supported formats: "
                + String.join(", ", supportedFormats));
        this.requestedFormat = requestedFormat;
        this.supportedFormats = List.copyOf(supportedFormats);
    }
}
