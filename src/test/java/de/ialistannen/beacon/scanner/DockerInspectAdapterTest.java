package de.ialistannen.beacon.scanner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.ListImagesCmd;
import com.github.dockerjava.api.command.PullImageCmd;
import com.github.dockerjava.api.command.PullImageResultCallback;
import de.ialistannen.beacon.model.ImageReference;
import de.ialistannen.beacon.scanner.AdapterFailure.ToolTimeout;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DockerInspectAdapterTest {

  private static final ImageReference REFERENCE = ImageReference.parse(
    "azurelinux/base/python:3.12",
    "mcr.microsoft.com"
  );

  private DockerClient client;
  private ScanWorkspace workspace;

  @BeforeEach
  void setUp() throws IOException {
    client = mock(DockerClient.class);
    workspace = ScanWorkspace.create();
  }

  @AfterEach
  void tearDown() {
    workspace.close();
  }

  @Test
  void slowPullIsAbortedOnTimeout() throws InterruptedException {
    ListImagesCmd listImages = mock(ListImagesCmd.class);
    when(client.listImagesCmd()).thenReturn(listImages);
    when(listImages.withReferenceFilter(REFERENCE.fullName())).thenReturn(listImages);
    when(listImages.exec()).thenReturn(List.of());

    AtomicReference<PullImageResultCallback> pull = new AtomicReference<>();
    PullImageCmd pullImage = mock(PullImageCmd.class);
    when(client.pullImageCmd(REFERENCE.repositoryName())).thenReturn(pullImage);
    when(pullImage.withTag(REFERENCE.tag())).thenReturn(pullImage);
    when(pullImage.exec(any(PullImageResultCallback.class))).thenAnswer(invocation -> {
      pull.set(invocation.getArgument(0));
      return invocation.getArgument(0);
    });

    AdapterOutcome outcome = new DockerInspectAdapter(client, false)
      .analyze(REFERENCE, Duration.ofMillis(50), workspace);

    assertThat(outcome).isEqualTo(new ToolTimeout("docker", Duration.ofMillis(50)));
    assertThat(pull.get()).isNotNull();
    // a closed callback counts as completed
    assertThat(pull.get().awaitCompletion(1, TimeUnit.SECONDS)).isTrue();
    verify(client, never()).inspectImageCmd(any());
  }
}
