package com.cario.cert.app.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;

import com.cario.cert.app.exception.PublishException;
import com.cario.cert.app.model.OutputFormat;
import com.cario.cert.app.model.PublishResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;

@ExtendWith(MockitoExtension.class)
class ArtifactPublisherTest {

  @Mock private S3Client s3;

  @Test
  void uploadsWithContentTypeAndLength() {
    given(s3.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
        .willReturn(PutObjectResponse.builder().eTag("\"e1\"").build());
    ArtifactPublisher publisher = new ArtifactPublisher(s3, "certs");

    PublishResult result =
        publisher.publish(
            "certificates/C1_Jane_Doe.docx",
            new byte[] {1, 2, 3, 4},
            OutputFormat.DOCX.contentType());

    ArgumentCaptor<PutObjectRequest> req = ArgumentCaptor.forClass(PutObjectRequest.class);
    then(s3).should().putObject(req.capture(), any(RequestBody.class));
    assertThat(req.getValue().bucket()).isEqualTo("certs");
    assertThat(req.getValue().key()).isEqualTo("certificates/C1_Jane_Doe.docx");
    assertThat(req.getValue().contentType()).isEqualTo(OutputFormat.DOCX.contentType());
    assertThat(req.getValue().contentLength()).isEqualTo(4L);

    assertThat(result.getKey()).isEqualTo("certificates/C1_Jane_Doe.docx");
    assertThat(result.getETag()).isEqualTo("\"e1\"");
    assertThat(result.getSize()).isEqualTo(4);
    assertThat(result.getS3Uri()).isEqualTo("s3://certs/certificates/C1_Jane_Doe.docx");
  }

  @Test
  void serviceErrorBecomesPublishException() {
    given(s3.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
        .willThrow(S3Exception.builder().statusCode(403).message("Access Denied").build());
    ArtifactPublisher publisher = new ArtifactPublisher(s3, "certs");

    assertThatThrownBy(() -> publisher.publish("k.pdf", new byte[] {1}, "application/pdf"))
        .isInstanceOf(PublishException.class)
        .hasMessageStartingWith("Failed to upload to S3:")
        .hasMessageContaining("Access Denied");
  }

  @Test
  void transportErrorBecomesPublishException() {
    given(s3.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
        .willThrow(SdkClientException.create("connection reset"));
    ArtifactPublisher publisher = new ArtifactPublisher(s3, "certs");

    assertThatThrownBy(() -> publisher.publish("k.pdf", new byte[] {1}, "application/pdf"))
        .isInstanceOf(PublishException.class);
  }
}
