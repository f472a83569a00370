package com.microblog.adapter.in.web;

import com.microblog.application.port.in.UploadMediaUseCase;
import com.microblog.domain.error.MediaError;
import com.microblog.domain.model.Media;
import com.microblog.domain.model.Result;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Media", description = "Media upload")
public class MediaController {

    private final UploadMediaUseCase uploadMediaUseCase;

    public MediaController(UploadMediaUseCase uploadMediaUseCase) {
        this.uploadMediaUseCase = uploadMediaUseCase;
    }

    @PostMapping(value = "/medias", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Upload a media file", description = "Stores the file unattached; pass the returned id when creating a tweet")
    public ResponseEntity<?> upload(@RequestParam("file") MultipartFile file) throws IOException {
        Result<Media, MediaError> result = uploadMediaUseCase.uploadMedia(
            file.getOriginalFilename(), file.getContentType(), file.getBytes());

        if (result.isFailure()) {
            MediaError error = result.errorOrNull();
            return ErrorResponses.of(error.kind(), error.code(), error.message());
        }
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(new MediaUploadedResponse(result.getOrThrow().id()));
    }

    public record MediaUploadedResponse(long mediaId) {}
}
