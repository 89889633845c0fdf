package com.eyelevel.batchorchestrator.controller;

import com.eyelevel.batchorchestrator.common.apiclient.authentication.Authentication;
import com.eyelevel.batchorchestrator.common.apiclient.authentication.impl.BearerTokenAuthentication;
import com.eyelevel.batchorchestrator.exception.BatchProcessingException;
import com.eyelevel.batchorchestrator.model.MediaFile;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

/**
 * Conversions from incoming request parts to the types the services work with.
 */
final class RequestAuthentication {

    private RequestAuthentication() {
    }

    /**
     * @return the caller's bearer token, or {@code null} so the client falls back to its service token.
     */
    static Authentication fromHeader(String authorization) {
        BearerTokenAuthentication auth = BearerTokenAuthentication.fromHeader(authorization);
        return auth.isPresent() ? auth : null;
    }

    static MediaFile toMediaFile(MultipartFile file) {
        try {
            return new MediaFile(file.getOriginalFilename(), file.getContentType(), file.getBytes(), null);
        } catch (IOException e) {
            throw new BatchProcessingException("Could not read the uploaded file '" + file.getOriginalFilename() + "'.",
                                               e);
        }
    }
}
