package io.estatekeeper.backend.activity;

import static io.estatekeeper.backend.testutil.TestActivityEventFactory.event;
import static io.estatekeeper.backend.testutil.TestActivityEventFactory.withFields;
import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class ActivityPresenterTest {

  private static final UUID ESTATE_ID = UUID.fromString("7b1f6a52-0c39-4d7e-9a8e-2f0d5f3c9b11");
  private static final Instant AT = Instant.parse("2025-03-01T10:00:00Z");
  private static final String ESTATE_HREF = "/app/estates/" + ESTATE_ID;

  private final ActivityPresenter presenter = new ActivityPresenter();

  @Test
  void invoiceEventWithSubjectLinksToFocusedInvoiceList() {
    var item =
        presenter.present(
            event(5, ESTATE_ID, AT, "invoice", "status_changed", "Invoice paid", "inv-9", null));

    assertThat(item.id()).isEqualTo("5");
    assertThat(item.estateId()).isEqualTo(ESTATE_ID);
    assertThat(item.timestamp()).isEqualTo(AT);
    assertThat(item.label()).isEqualTo("Invoice paid");
    assertThat(item.category()).isEqualTo(ActivityCategory.INVOICE);
    assertThat(item.tone()).isEqualTo(ActivityTone.WARNING);
    assertThat(item.badge()).isEqualTo("INVOICE");
    assertThat(item.href()).isEqualTo(ESTATE_HREF + "/invoices?focus=inv-9");
  }

  @Test
  void perCategoryLinkTemplates() {
    assertThat(hrefFor("document", "d1")).isEqualTo(ESTATE_HREF + "/documents/d1");
    assertThat(hrefFor("note", "n1")).isEqualTo(ESTATE_HREF + "/notes?focus=n1");
    assertThat(hrefFor("task", "t1")).isEqualTo(ESTATE_HREF + "/tasks?focus=t1");
    assertThat(hrefFor("expense", "x1")).isEqualTo(ESTATE_HREF + "/expenses/x1");
    assertThat(hrefFor("rent", "r1")).isEqualTo(ESTATE_HREF + "/rent/r1");
    assertThat(hrefFor("contact", "c1")).isEqualTo("/app/contacts/c1");
    assertThat(hrefFor("collaborator", "u1")).isEqualTo(ESTATE_HREF + "/collaborators");
  }

  @Test
  void missingSubjectFallsBackToEstateOverview() {
    assertThat(hrefFor("task", null)).isEqualTo(ESTATE_HREF);
    assertThat(hrefFor("document", "  ")).isEqualTo(ESTATE_HREF);
  }

  @Test
  void categoryWithoutTemplateFallsBackToEstateOverview() {
    assertThat(hrefFor("estate", "e1")).isEqualTo(ESTATE_HREF);
    assertThat(hrefFor("property", "p1")).isEqualTo(ESTATE_HREF);
  }

  @Test
  void subjectIdIsEncodedInLinks() {
    assertThat(hrefFor("document", "a b/c")).isEqualTo(ESTATE_HREF + "/documents/a%20b%2Fc");
  }

  @Test
  void storedHrefWinsOverTemplate() {
    var item =
        presenter.present(
            withFields(
                1, ESTATE_ID, AT, "task", "created", "x", "t1", "task", "/custom/link", null));

    assertThat(item.href()).isEqualTo("/custom/link");
  }

  @Test
  void emptyMessageIsDerivedFromCategoryAndAction() {
    var item = presenter.present(event(1, ESTATE_ID, AT, "task", "deleted", "  ", null, null));

    assertThat(item.label()).isEqualTo("task: deleted");
  }

  @Test
  void otherCategoryUsesReadableActionAsBadge() {
    var item =
        presenter.present(
            event(1, ESTATE_ID, AT, "OTHER", "time_entry_billed", "Billed", null, null));

    assertThat(item.category()).isEqualTo(ActivityCategory.OTHER);
    assertThat(item.tone()).isEqualTo(ActivityTone.NEUTRAL);
    assertThat(item.badge()).isEqualTo("time entry billed");
    assertThat(item.href()).isEqualTo(ESTATE_HREF);
  }

  @Test
  void sublabelPrefersStoredValueThenSubjectType() {
    var stored =
        presenter.present(
            withFields(1, ESTATE_ID, AT, "note", "created", "x", null, "note", null, "Call bank"));
    var fromType =
        presenter.present(event(2, ESTATE_ID, AT, "OTHER", "created", "x", "s1", "invoice"));
    var none = presenter.present(event(3, ESTATE_ID, AT, "OTHER", "created", "x", null, null));

    assertThat(stored.sublabel()).isEqualTo("Call bank");
    assertThat(fromType.sublabel()).isEqualTo("invoice");
    assertThat(none.sublabel()).isNull();
  }

  @Test
  void subjectTypeDrivesCategoryOverStoredKind() {
    var item = presenter.present(event(1, ESTATE_ID, AT, "TASK", "created", "x", "d7", "document"));

    assertThat(item.category()).isEqualTo(ActivityCategory.DOCUMENT);
    assertThat(item.tone()).isEqualTo(ActivityTone.SUCCESS);
    assertThat(item.href()).isEqualTo(ESTATE_HREF + "/documents/d7");
  }

  private String hrefFor(String category, String subjectId) {
    return presenter
        .present(event(1, ESTATE_ID, AT, category, "created", "x", subjectId, null))
        .href();
  }
}
