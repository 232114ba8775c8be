package rs.lukaj.minihttp.connections;

/**
 * Wrapper class for HTTP properties.
 */
public class Http {
    public static final String CRLF = "\r\n";
    /**
     * Version sent in request lines. Responses with any HTTP/1.x version are understood.
     */
    public static final String VERSION = "HTTP/1.1";

    private Http() {
    }

    /**
     * Denotes a request method (i.e. "http verb"). Methods not listed here can still be sent, see
     * {@link RequestSpec#getMethod()}.
     */
    public enum Verb {
        GET("GET", true, P.REQ_BODY_MUSTNT | P.RESP_BODY),
        POST("POST", true, P.RESP_BODY),
        PUT("PUT", true, P.RESP_BODY),
        DELETE("DELETE", true, P.RESP_BODY),
        HEAD("HEAD", true, P.REQ_BODY_MUSTNT),
        OPTIONS("OPTIONS", true, P.REQ_BODY_MUSTNT | P.RESP_BODY),
        PATCH("PATCH", true, P.RESP_BODY),

        //extras: might work, might not, but warning is printed when used nonetheless
        TRACE("TRACE", false, P.REQ_BODY_MUSTNT | P.RESP_BODY),
        CONNECT("CONNECT", false, P.REQ_BODY_MUSTNT);

        private static class P { //hack around illegal forward reference
            private static final long REQ_BODY_MUSTNT = 1; //can this request contain request body (set if can't)
            private static final long RESP_BODY = 1 << 1; //expecting a response with body?
        }

        private final String text;
        private final boolean supported;
        private final long properties;

        Verb(String text, boolean supported, long properties) {
            this.text = text;
            this.supported = supported;
            this.properties = properties;
        }

        /**
         * Find the verb for the method name. Method names are case-sensitive.
         * @param method method name
         * @return matching verb, or null if it isn't one of the known ones
         */
        public static Verb fromText(String method) {
            for(Verb v : values())
                if(v.text.equals(method)) return v;
            return null;
        }

        /**
         * Returns true if method is officially supported. If this method returns false, request may still work, but
         * no guarantees are given.
         * @return whether this method is supported
         */
        public boolean isSupported() {
            return supported;
        }

        /**
         * Denotes whether request body is allowed. If it isn't, then request cannot contain body.
         * @return whether request body is allowed
         */
        public boolean canProvideRequestBody() {
            return (properties & P.REQ_BODY_MUSTNT) == 0;
        }

        /**
         * @return whether response to this method has a body (HEAD responses, for one, never do)
         */
        public boolean responseHasBody() {
            return (properties & P.RESP_BODY) != 0;
        }

        @Override
        public String toString() {
            return text;
        }
    }


    /**
     * Checks whether the string is a valid token (RFC 7230), i.e. can be used as a method or a header name.
     * @param s string to check
     * @return true if it's a non-empty token
     */
    public static boolean isToken(String s) {
        if(s == null || s.isEmpty()) return false;
        for(int i=0; i<s.length(); i++) {
            char c = s.charAt(i);
            boolean tchar = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
                    || "!#$%&'*+-.^_`|~".indexOf(c) >= 0;
            if(!tchar) return false;
        }
        return true;
    }

    /**
     * Determines whether a response with this status code can have a body at all.
     * @param code status code
     * @return false for informative (1xx), 204 No Content and 304 Not Modified, true otherwise
     */
    public static boolean statusHasBody(int code) {
        return code/100 != 1 && code != 204 && code != 304;
    }
}
