package com.microblog.adapter.in.web;

import com.microblog.application.port.in.UploadMediaUseCase;
import com.microblog.application.port.in.VerifyCredentialUseCase;
import com.microblog.domain.error.MediaError;
import com.microblog.domain.error.ValidationError;
import com.microblog.domain.model.Media;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.User;
import com.microblog.domain.model.UserId;
import com.microblog.infrastructure.config.AppProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SuppressWarnings("removal")
@WebMvcTest(MediaController.class)
@Import(AppProperties.class)
class MediaControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private UploadMediaUseCase uploadMediaUseCase;

    @MockBean
    private VerifyCredentialUseCase verifyCredentialUseCase;

    @BeforeEach
    void setUp() {
        when(verifyCredentialUseCase.verifyCredential("test")).thenReturn(Result.success(new User(UserId.of(1), "Nick")));
    }

    @Test
    void shouldUploadFile() throws Exception {
        var file = new MockMultipartFile("file", "cat.png", "image/png", new byte[] {1, 2, 3});
        when(uploadMediaUseCase.uploadMedia(eq("cat.png"), eq("image/png"), any()))
            .thenReturn(Result.success(new Media(5, "0190-cat.png", null)));

        mockMvc.perform(multipart("/api/v1/medias").file(file).header("api-key", "test"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.mediaId").value(5));
    }

    @Test
    void shouldRejectUnsupportedType() throws Exception {
        var file = new MockMultipartFile("file", "notes.txt", "text/plain", new byte[] {1});
        when(uploadMediaUseCase.uploadMedia(eq("notes.txt"), eq("text/plain"), any()))
            .thenReturn(Result.failure(new MediaError.ValidationFailed(
                new ValidationError.MediaUploadError.UnsupportedContentType("text/plain"))));

        mockMvc.perform(multipart("/api/v1/medias").file(file).header("api-key", "test"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("MEDIA_UNSUPPORTED_TYPE"));
    }

    @Test
    void shouldRequireFilePart() throws Exception {
        mockMvc.perform(multipart("/api/v1/medias").header("api-key", "test"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
    }
}
