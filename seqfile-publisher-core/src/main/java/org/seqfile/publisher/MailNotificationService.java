package org.seqfile.publisher;

import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.List;
import java.util.Properties;

/**
 * {@link NotificationService} that mails the project's researcher over SMTP.
 *
 * <p>
 * The recipient is found by following the project record to its researcher record. The
 * message is {@code multipart/alternative} with a plain text and an HTML body listing the
 * archive and the files it contains.
 */
public class MailNotificationService implements NotificationService {

	private static final Logger logger = LoggerFactory.getLogger(MailNotificationService.class);

	/**
	 * Hands a composed message to the mail server.
	 */
	@FunctionalInterface
	interface MessageTransport {

		void send(MimeMessage message) throws MessagingException;

	}

	private final LimsService limsService;

	private final Session session;

	private final String from;

	private final String subjectPrefix;

	private final MessageTransport transport;

	public MailNotificationService(LimsService limsService, PublisherProperties properties) {
		this(limsService, properties, Transport::send);
	}

	MailNotificationService(LimsService limsService, PublisherProperties properties, MessageTransport transport) {
		Properties mail = new Properties();
		mail.put("mail.smtp.host", properties.getSmtpHost());
		mail.put("mail.smtp.port", String.valueOf(properties.getSmtpPort()));
		this.limsService = limsService;
		this.session = Session.getInstance(mail);
		this.from = properties.getMailFrom();
		this.subjectPrefix = properties.getMailSubjectPrefix();
		this.transport = transport;
	}

	@Override
	public void notifyPublished(PublishedBundle bundle, List<String> fileNames) {
		Owner owner = bundle.owner();
		ResearcherRecord researcher = findResearcher(owner);
		if (!researcher.hasEmail()) {
			throw new NotificationException(owner.id(), "researcher " + researcher.uri() + " has no email address");
		}

		MimeMessage message = compose(bundle, fileNames, researcher);
		try {
			logger.info("Sending notification for {} to {}", bundle.filename(), researcher.email());
			transport.send(message);
		}
		catch (MessagingException e) {
			throw new NotificationException(owner.id(), "could not send email to " + researcher.email() + ": "
					+ e.getMessage(), e);
		}
		logger.info("Notified {} about project {}", researcher.email(), owner.name());
	}

	private ResearcherRecord findResearcher(Owner owner) {
		try {
			ProjectRecord project = limsService.getProject(owner.uri());
			Reference researcher = project.researcher();
			if (researcher == null) {
				throw new NotificationException(owner.id(), "project " + owner.id() + " has no researcher");
			}
			logger.debug("Project {} belongs to researcher {}", owner.id(), researcher.uri());
			return limsService.getResearcher(researcher.uri());
		}
		catch (ClarityApiException | RecordParseException e) {
			throw new NotificationException(owner.id(), "researcher lookup failed: " + e.getMessage(), e);
		}
	}

	MimeMessage compose(PublishedBundle bundle, List<String> fileNames, ResearcherRecord researcher) {
		String charset = StandardCharsets.UTF_8.name();
		try {
			MimeBodyPart text = new MimeBodyPart();
			text.setText(textBody(bundle, fileNames, researcher), charset);
			MimeBodyPart html = new MimeBodyPart();
			html.setText(htmlBody(bundle, fileNames, researcher), charset, "html");

			MimeMultipart alternative = new MimeMultipart("alternative");
			alternative.addBodyPart(text);
			alternative.addBodyPart(html);

			MimeMessage message = new MimeMessage(session);
			message.setFrom(new InternetAddress(from));
			message.setRecipients(Message.RecipientType.TO, InternetAddress.parse(researcher.email()));
			message.setSubject(subjectPrefix + bundle.owner().name(), charset);
			message.setSentDate(new Date());
			message.setContent(alternative);
			return message;
		}
		catch (MessagingException e) {
			throw new NotificationException(bundle.owner().id(), "could not compose email: " + e.getMessage(), e);
		}
	}

	static String textBody(PublishedBundle bundle, List<String> fileNames, ResearcherRecord researcher) {
		StringBuilder body = new StringBuilder();
		body.append("Dear ").append(greetingName(researcher)).append(",\n\n");
		body.append("Sequencing files for project ")
			.append(bundle.owner().name())
			.append(" (")
			.append(bundle.owner().id())
			.append(") have been published and are available for download.\n\n");
		body.append("Archive: ")
			.append(bundle.filename())
			.append(" (")
			.append(bundle.fileCount())
			.append(" files)\n\n");
		body.append("Files:\n");
		for (String name : fileNames) {
			body.append("  - ").append(name).append('\n');
		}
		body.append("\nThis message was sent automatically. Please do not reply.\n");
		return body.toString();
	}

	static String htmlBody(PublishedBundle bundle, List<String> fileNames, ResearcherRecord researcher) {
		StringBuilder body = new StringBuilder();
		body.append("<html><body>\n");
		body.append("<p>Dear ").append(XmlNodeUtils.escapeXml(greetingName(researcher))).append(",</p>\n");
		body.append("<p>Sequencing files for project <strong>")
			.append(XmlNodeUtils.escapeXml(bundle.owner().name()))
			.append("</strong> (")
			.append(XmlNodeUtils.escapeXml(bundle.owner().id()))
			.append(") have been published and are available for download.</p>\n");
		body.append("<p>Archive: <code>")
			.append(XmlNodeUtils.escapeXml(bundle.filename()))
			.append("</code> (")
			.append(bundle.fileCount())
			.append(" files)</p>\n");
		body.append("<ul>\n");
		for (String name : fileNames) {
			body.append("<li>").append(XmlNodeUtils.escapeXml(name)).append("</li>\n");
		}
		body.append("</ul>\n");
		body.append("<p><small>This message was sent automatically. Please do not reply.</small></p>\n");
		body.append("</body></html>\n");
		return body.toString();
	}

	private static String greetingName(ResearcherRecord researcher) {
		String name = researcher.fullName();
		return name != null ? name : "researcher";
	}

}
