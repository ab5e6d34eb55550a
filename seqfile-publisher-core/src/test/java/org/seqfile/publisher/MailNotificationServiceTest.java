package org.seqfile.publisher;

import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("MailNotificationService Tests")
@ExtendWith(MockitoExtension.class)
class MailNotificationServiceTest {

	private static final String PROJECT_URI = "https://lims/api/v2/projects/P1";

	private static final String RESEARCHER_URI = "https://lims/api/v2/researchers/3";

	private static final Owner OWNER = new Owner("Project A", "P1", PROJECT_URI);

	private static final PublishedBundle BUNDLE = new PublishedBundle(OWNER, "Project A_sequencing_files.zip", "40-9",
			"https://lims/api/v2/files/40-9", 2, true);

	private static final List<String> FILES = List.of("S1.ab1", "S1.seq");

	@Mock
	private LimsService limsService;

	@Mock
	private MailNotificationService.MessageTransport transport;

	private MailNotificationService service;

	@BeforeEach
	void setUp() {
		PublisherProperties properties = new PublisherProperties();
		properties.setMailFrom("lims@example.org");
		service = new MailNotificationService(limsService, properties, transport);
	}

	private void givenResearcher(ResearcherRecord researcher) {
		when(limsService.getProject(PROJECT_URI))
			.thenReturn(new ProjectRecord("P1", PROJECT_URI, "Project A", new Reference(RESEARCHER_URI, null)));
		when(limsService.getResearcher(RESEARCHER_URI)).thenReturn(researcher);
	}

	@Nested
	@DisplayName("Sending")
	class SendingTest {

		@Test
		@DisplayName("Should mail the project's researcher")
		void shouldMailResearcher() throws Exception {
			givenResearcher(new ResearcherRecord(RESEARCHER_URI, "Ada", "Lovelace", "ada@example.org"));

			service.notifyPublished(BUNDLE, FILES);

			ArgumentCaptor<MimeMessage> message = ArgumentCaptor.forClass(MimeMessage.class);
			verify(transport).send(message.capture());
			assertThat(message.getValue().getSubject()).isEqualTo("Sequencing Files Available - Project A");
			assertThat(message.getValue().getFrom()).containsExactly(new InternetAddress("lims@example.org"));
			assertThat(message.getValue().getRecipients(Message.RecipientType.TO))
				.containsExactly(new InternetAddress("ada@example.org"));
		}

		@Test
		@DisplayName("Should send a text and an HTML alternative")
		void shouldComposeAlternatives() throws Exception {
			MimeMessage message = service.compose(BUNDLE, FILES,
					new ResearcherRecord(RESEARCHER_URI, "Ada", "Lovelace", "ada@example.org"));

			assertThat(message.getContent()).isInstanceOfSatisfying(MimeMultipart.class, multipart -> {
				try {
					assertThat(multipart.getCount()).isEqualTo(2);
					assertThat(multipart.getContentType()).startsWith("multipart/alternative");
				}
				catch (MessagingException e) {
					throw new AssertionError(e);
				}
			});
		}

	}

	@Nested
	@DisplayName("Failures")
	class FailureTest {

		@Test
		@DisplayName("Should fail when the project has no researcher")
		void shouldFailWithoutResearcher() {
			when(limsService.getProject(PROJECT_URI)).thenReturn(new ProjectRecord("P1", PROJECT_URI, "Project A"));

			assertThatThrownBy(() -> service.notifyPublished(BUNDLE, FILES)).isInstanceOf(NotificationException.class)
				.hasMessageContaining("has no researcher")
				.extracting(e -> ((NotificationException) e).getProjectId())
				.isEqualTo("P1");
			verifyNoInteractions(transport);
		}

		@Test
		@DisplayName("Should fail when the researcher has no email address")
		void shouldFailWithoutEmail() {
			givenResearcher(new ResearcherRecord(RESEARCHER_URI, "Ada", "Lovelace", null));

			assertThatThrownBy(() -> service.notifyPublished(BUNDLE, FILES)).isInstanceOf(NotificationException.class)
				.hasMessageContaining("no email address");
			verifyNoInteractions(transport);
		}

		@Test
		@DisplayName("Should wrap LIMS errors during the researcher lookup")
		void shouldWrapLookupFailure() {
			when(limsService.getProject(PROJECT_URI)).thenThrow(new ClarityApiException("Not Found", 404, ""));

			assertThatThrownBy(() -> service.notifyPublished(BUNDLE, FILES)).isInstanceOf(NotificationException.class)
				.hasMessageContaining("researcher lookup failed")
				.hasCauseInstanceOf(ClarityApiException.class);
		}

		@Test
		@DisplayName("Should wrap mail server errors")
		void shouldWrapTransportFailure() throws Exception {
			givenResearcher(new ResearcherRecord(RESEARCHER_URI, "Ada", "Lovelace", "ada@example.org"));
			doThrow(new MessagingException("Connection refused")).when(transport).send(any());

			assertThatThrownBy(() -> service.notifyPublished(BUNDLE, FILES)).isInstanceOf(NotificationException.class)
				.hasMessageContaining("ada@example.org")
				.hasMessageContaining("Connection refused")
				.hasCauseInstanceOf(MessagingException.class);
		}

	}

	@Nested
	@DisplayName("Message bodies")
	class BodyTest {

		@Test
		@DisplayName("Should list the archive and its files in the text body")
		void shouldWriteTextBody() {
			String body = MailNotificationService.textBody(BUNDLE, FILES,
					new ResearcherRecord(RESEARCHER_URI, "Ada", "Lovelace", "ada@example.org"));

			assertThat(body).startsWith("Dear Ada Lovelace,")
				.contains("project Project A (P1)")
				.contains("Archive: Project A_sequencing_files.zip (2 files)")
				.contains("  - S1.ab1\n  - S1.seq\n");
		}

		@Test
		@DisplayName("Should greet generically when the researcher has no name")
		void shouldGreetWithoutName() {
			String body = MailNotificationService.textBody(BUNDLE, FILES,
					new ResearcherRecord(RESEARCHER_URI, null, null, "ada@example.org"));

			assertThat(body).startsWith("Dear researcher,");
		}

		@Test
		@DisplayName("Should escape names in the HTML body")
		void shouldEscapeHtmlBody() {
			Owner owner = new Owner("R&D <pilot>", "P2", "https://lims/api/v2/projects/P2");
			PublishedBundle bundle = new PublishedBundle(owner, "R&D <pilot>_sequencing_files.zip", "40-10",
					"https://lims/api/v2/files/40-10", 1, true);

			String body = MailNotificationService.htmlBody(bundle, List.of("a<b>.ab1"),
					new ResearcherRecord(RESEARCHER_URI, "Ada", "Lovelace", "ada@example.org"));

			assertThat(body).contains("<strong>R&amp;D &lt;pilot&gt;</strong>")
				.contains("<li>a&lt;b&gt;.ab1</li>")
				.doesNotContain("<pilot>");
		}

	}

}
