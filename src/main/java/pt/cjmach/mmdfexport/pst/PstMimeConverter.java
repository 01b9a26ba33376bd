/*
 *  Copyright 2022-2025 Carlos Machado
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */
package pt.cjmach.mmdfexport.pst;

import com.pff.PSTAttachment;
import com.pff.PSTException;
import com.pff.PSTMessage;
import com.pff.PSTRecipient;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.Enumeration;
import javax.activation.DataHandler;
import javax.activation.DataSource;
import javax.mail.BodyPart;
import javax.mail.Header;
import javax.mail.Message;
import javax.mail.MessagingException;
import javax.mail.Part;
import javax.mail.Session;
import javax.mail.internet.InternetAddress;
import javax.mail.internet.InternetHeaders;
import javax.mail.internet.MailDateFormat;
import javax.mail.internet.MimeBodyPart;
import javax.mail.internet.MimeMessage;
import javax.mail.internet.MimeMultipart;
import javax.mail.util.ByteArrayDataSource;
import org.apache.commons.lang3.StringUtils;
import org.apache.tika.mime.MimeTypeException;
import org.apache.tika.mime.MimeTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pt.cjmach.mmdfexport.convert.ConversionException;
import pt.cjmach.mmdfexport.convert.MessageConverter;
import pt.cjmach.mmdfexport.mailbox.MailboxException;
import pt.cjmach.mmdfexport.mailbox.MapiObject;

/**
 * Converts a {@link PSTMessage} to an RFC 822 / MIME byte stream.
 *
 * @author cmachado
 */
public class PstMimeConverter implements MessageConverter {

    private static final Logger logger = LoggerFactory.getLogger(PstMimeConverter.class);
    private static final MailDateFormat RFC822_DATE_FORMAT = new MailDateFormat();

    /**
     * Content transfer encoding used for text bodies by default.
     */
    public static final String DEFAULT_BODY_ENCODING = "quoted-printable"; // NOI18N

    private static final String SMTP_ADDRESS_TYPE = "SMTP"; // NOI18N

    private Charset charset = StandardCharsets.UTF_8;
    private String bodyEncoding = DEFAULT_BODY_ENCODING;
    private boolean resolveAddresses;

    static {
        // see: https://docs.oracle.com/javaee/6/api/javax/mail/internet/package-summary.html#package_description
        System.setProperty("mail.mime.address.strict", "false"); // NOI18N
    }

    public PstMimeConverter() {
    }

    /**
     * Sets the charset used to decode the transport headers stored in the PST.
     *
     * @param charset
     */
    public void setCharset(Charset charset) {
        if (charset == null) {
            throw new IllegalArgumentException("charset is null.");
        }
        this.charset = charset;
    }

    public Charset getCharset() {
        return charset;
    }

    /**
     * Sets the content transfer encoding of text bodies, e.g.
     * {@code quoted-printable} or {@code base64}.
     *
     * @param bodyEncoding
     */
    public void setBodyEncoding(String bodyEncoding) {
        if (StringUtils.isBlank(bodyEncoding)) {
            throw new IllegalArgumentException("bodyEncoding is empty.");
        }
        this.bodyEncoding = bodyEncoding;
    }

    public String getBodyEncoding() {
        return bodyEncoding;
    }

    @Override
    public void setResolveAddresses(boolean resolveAddresses) {
        this.resolveAddresses = resolveAddresses;
    }

    public boolean isResolveAddresses() {
        return resolveAddresses;
    }

    @Override
    public void writeMime(MapiObject message, OutputStream output) throws ConversionException {
        PSTMessage pstMessage;
        try {
            pstMessage = message.unwrap(PSTMessage.class);
        } catch (MailboxException ex) {
            throw new ConversionException("Not a PST message.", ex);
        }
        try {
            convertToMimeMessage(pstMessage).writeTo(output);
        } catch (MessagingException | PSTException | IOException ex) {
            throw new ConversionException("Failed to convert message " + pstMessage.getDescriptorNodeId(), ex);
        } catch (RuntimeException ex) {
            // java-libpst throws NullPointerException and friends on damaged items.
            throw new ConversionException("Failed to read message " + pstMessage.getDescriptorNodeId(), ex);
        }
    }

    /**
     * Converts a PSTMessage to MimeMessage.
     *
     * @param message The PSTMessage object.
     * @return A new MimeMessage object.
     * @throws MessagingException
     * @throws IOException
     * @throws PSTException
     */
    MimeMessage convertToMimeMessage(PSTMessage message) throws MessagingException, IOException, PSTException {
        MimeMessage mimeMessage = new MimeMessage((Session) null) {
            @Override
            protected void updateMessageID() throws MessagingException {
                // keep the Message-ID copied from the transport headers.
                if (getHeader("Message-ID") == null) { // NOI18N
                    super.updateMessageID();
                }
            }
        };

        convertMessageHeaders(message, mimeMessage);
        // Add custom header to easily track the original message from OST/PST file.
        mimeMessage.addHeader(DESCRIPTOR_ID_HEADER, Long.toString(message.getDescriptorNodeId()));
        mimeMessage.addHeader(DELIVERY_TIME_HEADER, Long.toString(extractInternalDate(message).getTime()));

        MimeMultipart relatedMultipart = new MimeMultipart("related"); // NOI18N
        convertMessageBody(message, relatedMultipart);
        MimeMultipart rootMultipart = new MimeMultipart("mixed"); // NOI18N
        convertAttachments(message, rootMultipart, relatedMultipart);

        if (relatedMultipart.getCount() > 1) {
            MimeBodyPart relatedBodyPart = new MimeBodyPart();
            relatedBodyPart.setContent(relatedMultipart);

            if (rootMultipart.getCount() > 0) {
                rootMultipart.addBodyPart(relatedBodyPart, 0);
                mimeMessage.setContent(rootMultipart);
            } else {
                mimeMessage.setContent(relatedMultipart);
            }
        } else if (relatedMultipart.getCount() == 1) {
            BodyPart bodyPart = relatedMultipart.getBodyPart(0);
            if (rootMultipart.getCount() > 0) {
                rootMultipart.addBodyPart(bodyPart, 0);
                mimeMessage.setContent(rootMultipart);
            } else {
                mimeMessage.setContent(bodyPart.getContent(), bodyPart.getContentType());
                mimeMessage.setHeader("Content-Transfer-Encoding", bodyEncoding); // NOI18N
            }
        } else {
            mimeMessage.setContent(rootMultipart);
        }
        return mimeMessage;
    }

    void convertMessageHeaders(PSTMessage message, MimeMessage mimeMessage) throws IOException, MessagingException, PSTException {
        String messageHeaders = message.getTransportMessageHeaders();
        if (messageHeaders != null && !messageHeaders.isEmpty()) {
            try (InputStream headersStream = new ByteArrayInputStream(messageHeaders.getBytes(charset))) {
                InternetHeaders headers = new InternetHeaders(headersStream);
                headers.removeHeader("Content-Type"); // NOI18N
                headers.removeHeader("Content-Transfer-Encoding"); // NOI18N
                headers.removeHeader("MIME-Version"); // NOI18N

                Enumeration<Header> allHeaders = headers.getAllHeaders();
                while (allHeaders.hasMoreElements()) {
                    Header header = allHeaders.nextElement();
                    mimeMessage.addHeader(header.getName(), header.getValue());
                }
                String dateHeader = mimeMessage.getHeader("Date", null); // NOI18N
                if (dateHeader == null || dateHeader.isEmpty()) {
                    mimeMessage.addHeader("Date", RFC822_DATE_FORMAT.format(extractInternalDate(message))); // NOI18N
                }
            }
        } else {
            mimeMessage.setSubject(message.getSubject());
            Date sentDate = message.getClientSubmitTime();
            if (sentDate == null) {
                sentDate = extractInternalDate(message);
            }
            mimeMessage.setSentDate(sentDate);

            InternetAddress fromMailbox = new InternetAddress();
            String senderEmailAddress = message.getSenderEmailAddress();
            fromMailbox.setAddress(senderEmailAddress);
            String senderName = message.getSenderName();
            fromMailbox.setPersonal(StringUtils.isNotEmpty(senderName) ? senderName : senderEmailAddress);
            mimeMessage.setFrom(fromMailbox);

            for (int i = 0; i < message.getNumberOfRecipients(); i++) {
                PSTRecipient recipient = message.getRecipient(i);
                InternetAddress address = new InternetAddress(recipientAddress(recipient), recipient.getDisplayName());
                switch (recipient.getRecipientType()) {
                    case PSTRecipient.MAPI_TO:
                        mimeMessage.addRecipient(Message.RecipientType.TO, address);
                        break;
                    case PSTRecipient.MAPI_CC:
                        mimeMessage.addRecipient(Message.RecipientType.CC, address);
                        break;
                    case PSTRecipient.MAPI_BCC:
                        mimeMessage.addRecipient(Message.RecipientType.BCC, address);
                        break;
                    default:
                        break;
                }
            }
        }
    }

    /**
     * Returns the address of a recipient. When address resolution is enabled,
     * recipients with a non SMTP address (e.g. Exchange {@code EX} entries)
     * are written with their SMTP address, if the PST stores one.
     *
     * @param recipient
     * @return the address to write in the message headers.
     */
    String recipientAddress(PSTRecipient recipient) {
        String address = recipient.getEmailAddress();
        if (resolveAddresses && !SMTP_ADDRESS_TYPE.equalsIgnoreCase(recipient.getEmailAddressType())) {
            String smtpAddress = recipient.getSmtpAddress();
            if (StringUtils.isNotEmpty(smtpAddress)) {
                return smtpAddress;
            }
        }
        return address;
    }

    void convertMessageBody(PSTMessage message, MimeMultipart relatedMultipart) throws IOException, MessagingException {
        String messageBody = message.getBody();
        String messageBodyHTML = message.getBodyHTML();

        if (StringUtils.isNotEmpty(messageBodyHTML)) {
            MimeMultipart alternativeMultipart = new MimeMultipart("alternative"); // NOI18N
            if (StringUtils.isNotEmpty(messageBody)) {
                alternativeMultipart.addBodyPart(createTextPart(messageBody, "plain")); // NOI18N
            }
            alternativeMultipart.addBodyPart(createTextPart(messageBodyHTML, "html")); // NOI18N

            MimeBodyPart alternativeBodyPart = new MimeBodyPart();
            alternativeBodyPart.setContent(alternativeMultipart);
            relatedMultipart.addBodyPart(alternativeBodyPart);
        } else {
            relatedMultipart.addBodyPart(createTextPart(StringUtils.defaultString(messageBody), "plain")); // NOI18N
        }
    }

    private MimeBodyPart createTextPart(String text, String subtype) throws MessagingException {
        MimeBodyPart textBodyPart = new MimeBodyPart();
        textBodyPart.setText(text, StandardCharsets.UTF_8.name(), subtype);
        textBodyPart.setHeader("Content-Transfer-Encoding", bodyEncoding); // NOI18N
        return textBodyPart;
    }

    void convertAttachments(PSTMessage message, MimeMultipart rootMultipart, MimeMultipart relatedMultipart) throws MessagingException, PSTException, IOException {
        for (int i = 0; i < message.getNumberOfAttachments(); i++) {
            PSTAttachment attachment = message.getAttachment(i);
            if (attachment == null) {
                continue;
            }
            byte[] data = getAttachmentBytes(attachment);
            if (data == null) {
                logger.warn("Failed to extract bytes of attachment {} from message {}.",
                        attachment.getDescriptorNodeId(), message.getDescriptorNodeId());
                // try to add the attachment, which may still be useful even without its contents.
                data = new byte[0];
            }

            MimeBodyPart attachmentBodyPart = new MimeBodyPart();
            try {
                DataSource source = new ByteArrayDataSource(data, getAttachmentMimeTag(attachment));
                attachmentBodyPart.setDataHandler(new DataHandler(source));

                String fileName = coalesce("attachment-" + attachment.getDescriptorNodeId(), // NOI18N
                        attachment.getLongFilename(), attachment.getDisplayName(), attachment.getFilename());
                attachmentBodyPart.setFileName(fileName);

                // Inline attachments have a Content-ID and belong to the related multipart.
                String contentId = attachment.getContentId();
                if (StringUtils.isNotEmpty(contentId)) {
                    if (!contentId.startsWith("<")) {
                        contentId = "<" + contentId + ">";
                    }
                    attachmentBodyPart.setContentID(contentId);
                    attachmentBodyPart.setDisposition(Part.INLINE);
                    relatedMultipart.addBodyPart(attachmentBodyPart);
                } else {
                    attachmentBodyPart.setDisposition(Part.ATTACHMENT);
                    rootMultipart.addBodyPart(attachmentBodyPart);
                }
            } catch (NullPointerException ex) {
                logger.warn("Failed to convert attachment {} from message {}.",
                        attachment.getDescriptorNodeId(), message.getDescriptorNodeId(), ex);
            }
        }
    }

    static boolean isMimeTypeKnown(String mime) {
        MimeTypes types = MimeTypes.getDefaultMimeTypes();
        try {
            types.forName(mime);
            return true;
        } catch (MimeTypeException ex) {
            logger.warn("Unknown mime type {}", mime);
            return false;
        }
    }

    /**
     * Extracts the content of the PSTAttachment.
     *
     * @param attachment
     * @return A byte array with the attachment content, or {@code null} if
     * the attachment has no content stream.
     * @throws PSTException If it's not possible to get the attachment input
     * stream.
     * @throws IOException If an error occurs when reading bytes from the input
     * stream.
     */
    static byte[] getAttachmentBytes(PSTAttachment attachment) throws PSTException, IOException {
        InputStream input;
        try {
            input = attachment.getFileInputStream();
        } catch (NullPointerException ex) {
            return null;
        }
        if (input == null) {
            return null;
        }
        try (InputStream in = input; ByteArrayOutputStream output = new ByteArrayOutputStream()) {
            byte[] buffer = new byte[4096];
            int nread;
            while ((nread = in.read(buffer, 0, buffer.length)) != -1) {
                output.write(buffer, 0, nread);
            }
            return output.toByteArray();
        }
    }

    /**
     * mimeTag should contain a valid mime type, but sometimes it doesn't. To
     * prevent exceptions when the MimeMessage is validated, unknown values are
     * replaced by {@code application/octet-stream}.
     *
     * @param attachment
     * @return the mime type of the attachment.
     */
    static String getAttachmentMimeTag(PSTAttachment attachment) {
        String mimeTag = null;
        try {
            mimeTag = attachment.getMimeTag();
        } catch (NullPointerException ex) {
            logger.debug("Attachment {} has no mime tag.", attachment.getDescriptorNodeId());
        }
        if (StringUtils.isNotEmpty(mimeTag) && isMimeTypeKnown(mimeTag)) {
            return mimeTag;
        }
        return "application/octet-stream"; // NOI18N
    }

    static String coalesce(String defaultValue, String... args) {
        for (String arg : args) {
            if (arg != null && !arg.isEmpty()) {
                return arg;
            }
        }
        return defaultValue;
    }

    /**
     * Extracts the most appropriate date from a PSTMessage.
     * Priority order:
     * 1. MessageDeliveryTime  (Exchange reception date)
     * 2. ClientSubmitTime     (send date, useful for "Sent" items)
     * 3. CreationTime         (creation date in the PST)
     * 4. Current date         (last resort)
     *
     * @param message
     * @return the date.
     */
    public static Date extractInternalDate(PSTMessage message) {
        Date date = message.getMessageDeliveryTime();
        if (isValidDate(date)) {
            return date;
        }
        date = message.getClientSubmitTime();
        if (isValidDate(date)) {
            return date;
        }
        date = message.getCreationTime();
        if (isValidDate(date)) {
            return date;
        }
        return new Date();
    }

    /**
     * Checks that a date is neither null nor epoch (Date(0)), which is
     * returned by java-libpst when the property is empty.
     */
    static boolean isValidDate(Date date) {
        return date != null && date.getTime() != 0;
    }
}
