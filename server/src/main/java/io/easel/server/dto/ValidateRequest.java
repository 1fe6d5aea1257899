package io.easel.server.dto;

import java.util.List;

/**
 * JSON body for POST /images/validate.
 * Example:
 *   { "urls": ["https://img.example.org/1.jpg", "https://img.example.org/2.png"] }
 */
public class ValidateRequest {
    public List<String> urls;
}
