package com.example.ordersummary.service;

import java.io.IOException;

/**
 * The source document could not be opened. Fatal for the whole upload.
 */
public class DocumentOpenException extends IOException {

    private static final long serialVersionUID = 1L;

    public DocumentOpenException(String message, Throwable cause) {
        super(message, cause);
    }
}
