package org.springaicommunity.social.graph;

/**
 * Exception thrown when a signed request fails verification.
 */
public class SignedRequestException extends RuntimeException {

	/**
	 * Why a signed request was rejected.
	 */
	public enum Reason {

		MALFORMED("Malformed input"),

		UNSUPPORTED_ALGORITHM("Unsupported algorithm"),

		TOO_OLD("Too old"),

		INVALID_SIGNATURE("Invalid signature"),

		DECRYPTION_FAILED("Decryption failed");

		private final String description;

		Reason(String description) {
			this.description = description;
		}

		public String getDescription() {
			return description;
		}

	}

	private final Reason reason;

	public SignedRequestException(Reason reason) {
		super(message(reason));
		this.reason = reason;
	}

	public SignedRequestException(Reason reason, Throwable cause) {
		super(message(reason), cause);
		this.reason = reason;
	}

	public Reason getReason() {
		return reason;
	}

	private static String message(Reason reason) {
		return "Invalid request. (" + reason.getDescription() + ".)";
	}

}
