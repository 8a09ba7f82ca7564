package com.guidestore.controllers;

import com.guidestore.errors.AddressingException;
import com.guidestore.errors.ErrorDetails;
import io.javalin.Javalin;
import io.javalin.http.Context;

/**
 * Interface for API controllers.
 * Each controller registers its routes with the Javalin app.
 */
public interface Controller {

    void registerRoutes(Javalin app);

    /**
     * Structured error body {error, code, category, context}; never fails on
     * a null message.
     */
    static ErrorDetails errorBody(Exception e) {
        return ErrorDetails.from(e);
    }

    static String requireQuery(Context ctx, String name) {
        String value = ctx.queryParam(name);
        if (value == null || value.isBlank()) {
            throw AddressingException.missingParameter(name);
        }
        return value;
    }
}
