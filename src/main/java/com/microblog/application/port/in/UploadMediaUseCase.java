package com.microblog.application.port.in;

import com.microblog.domain.error.MediaError;
import com.microblog.domain.model.Media;
import com.microblog.domain.model.Result;

public interface UploadMediaUseCase {

    Result<Media, MediaError> uploadMedia(String filename, String contentType, byte[] content);
}
