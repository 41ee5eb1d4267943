package com.basecamp.sdk;

/**
 * File uploads. The returned {@link Attachment#attachableSgid()} can be embedded in rich
 * text.
 */
public class AttachmentsService extends BaseService {

	public AttachmentsService(ServiceContext context) {
		super(context, "Attachments");
	}

	/**
	 * Upload a file. The bytes are sent as-is with the given content type.
	 * @param filename file name shown in Basecamp
	 * @param contentType MIME type, e.g. {@code image/png} or
	 * {@code application/octet-stream}
	 * @param data file contents
	 * @return the created attachment
	 */
	public Attachment create(String filename, String contentType, byte[] data) {
		requireNonBlank(filename, "Attachment filename is required");
		requireNonBlank(contentType, "Attachment content type is required");
		if (data.length == 0) {
			throw BasecampException.usage("Attachment data is empty");
		}
		RequestSpec spec = RequestSpec.upload(path("/attachments.json"), data, contentType).withQuery("name", filename);
		return request(writeOperation("CreateAttachment", "attachment", null), spec, Attachment.class);
	}

}
