package io.estatekeeper.backend.estate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import io.estatekeeper.backend.exception.EstateEditDeniedException;
import io.estatekeeper.backend.exception.EstateNotFoundException;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class EstateAccessServiceTest {

  private static final UUID ESTATE_ID = UUID.randomUUID();

  @Mock private EstateMembershipDirectory membershipDirectory;
  @InjectMocks private EstateAccessService accessService;

  @Test
  void viewerCanView() {
    when(membershipDirectory.findRole(ESTATE_ID, "viewer"))
        .thenReturn(Optional.of(EstateRole.VIEWER));

    assertThat(accessService.requireViewAccess(ESTATE_ID, "viewer")).isEqualTo(EstateRole.VIEWER);
  }

  @Test
  void nonMemberGetsNotFound() {
    when(membershipDirectory.findRole(ESTATE_ID, "stranger")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> accessService.requireViewAccess(ESTATE_ID, "stranger"))
        .isInstanceOf(EstateNotFoundException.class);
  }

  @Test
  void viewerCannotEdit() {
    when(membershipDirectory.findRole(ESTATE_ID, "viewer"))
        .thenReturn(Optional.of(EstateRole.VIEWER));

    assertThatThrownBy(() -> accessService.requireEditAccess(ESTATE_ID, "viewer"))
        .isInstanceOf(EstateEditDeniedException.class);
  }

  @Test
  void editorAndOwnerCanEdit() {
    when(membershipDirectory.findRole(ESTATE_ID, "editor"))
        .thenReturn(Optional.of(EstateRole.EDITOR));
    when(membershipDirectory.findRole(ESTATE_ID, "owner"))
        .thenReturn(Optional.of(EstateRole.OWNER));

    assertThat(accessService.requireEditAccess(ESTATE_ID, "editor")).isEqualTo(EstateRole.EDITOR);
    assertThat(accessService.requireEditAccess(ESTATE_ID, "owner")).isEqualTo(EstateRole.OWNER);
  }
}
