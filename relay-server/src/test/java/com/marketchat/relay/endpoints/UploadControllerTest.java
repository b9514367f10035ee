package com.marketchat.relay.endpoints;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest(properties = {
    "relay.upload.dir=target/test-uploads",
    "relay.upload.base-url=http://files.test",
    "relay.upload.max-bytes=1024"
})
@AutoConfigureMockMvc
class UploadControllerTest {

  @Autowired
  private MockMvc mockMvc;

  @Test
  void imageIsStoredUnderImages() throws Exception {
    MockMultipartFile file = new MockMultipartFile("file", "photo.png", "image/png", new byte[] {1, 2, 3});

    mockMvc.perform(multipart("/upload").file(file))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true))
        .andExpect(jsonPath("$.fileUrl", containsString("http://files.test/files/images/")))
        .andExpect(jsonPath("$.fileName").value("photo.png"))
        .andExpect(jsonPath("$.fileSize").value(3))
        .andExpect(jsonPath("$.resourceType").value("image"))
        .andExpect(jsonPath("$.thumbnailUrl").isNotEmpty());
  }

  @Test
  void documentIsStoredUnderDocuments() throws Exception {
    MockMultipartFile file = new MockMultipartFile("file", "offer.pdf", "application/pdf", new byte[] {4, 5});

    mockMvc.perform(multipart("/upload").file(file))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.publicId", containsString("documents/")))
        .andExpect(jsonPath("$.resourceType").value("raw"));
  }

  @Test
  void unsupportedTypeIsRejected() throws Exception {
    MockMultipartFile file = new MockMultipartFile("file", "notes.txt", "text/plain", new byte[] {1});

    mockMvc.perform(multipart("/upload").file(file))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"));
  }

  @Test
  void missingFileIsRejected() throws Exception {
    mockMvc.perform(multipart("/upload"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errorMessage").value("No file uploaded"));
  }

  @Test
  void oversizedFileIsPayloadTooLarge() throws Exception {
    MockMultipartFile file = new MockMultipartFile("file", "big.png", "image/png", new byte[2048]);

    mockMvc.perform(multipart("/upload").file(file))
        .andExpect(status().isPayloadTooLarge());
  }
}
