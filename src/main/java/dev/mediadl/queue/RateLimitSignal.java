package dev.mediadl.queue;

import com.fasterxml.jackson.annotation.JsonProperty;

/** An externally detected indication that the site has throttled further activity */
public record RateLimitSignal(@JsonProperty("reason") String reason, @JsonProperty("location") String location) {

	/** Signal for a redirect to a restricted-access page */
	public static RateLimitSignal redirect(String location) {
		return new RateLimitSignal("redirected to restricted page", location);
	}

	@Override
	public String toString() {
		return location == null ? reason : reason + " (" + location + ")";
	}
}
