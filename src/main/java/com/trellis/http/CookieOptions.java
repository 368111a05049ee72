package com.trellis.http;

/** Attributes appended to a Set-Cookie header by {@link Response#cookie}. */
public class CookieOptions {
  private Long maxAge;
  private String expires;
  private String path;
  private String domain;
  private boolean secure;
  private boolean httpOnly;
  private String sameSite;

  public static CookieOptions defaults() {
    return new CookieOptions();
  }

  public Long getMaxAge() {
    return maxAge;
  }

  public CookieOptions maxAge(long seconds) {
    this.maxAge = seconds;
    return this;
  }

  public String getExpires() {
    return expires;
  }

  public CookieOptions expires(String expires) {
    this.expires = expires;
    return this;
  }

  public String getPath() {
    return path;
  }

  public CookieOptions path(String path) {
    this.path = path;
    return this;
  }

  public String getDomain() {
    return domain;
  }

  public CookieOptions domain(String domain) {
    this.domain = domain;
    return this;
  }

  public boolean isSecure() {
    return secure;
  }

  public CookieOptions secure(boolean secure) {
    this.secure = secure;
    return this;
  }

  public boolean isHttpOnly() {
    return httpOnly;
  }

  public CookieOptions httpOnly(boolean httpOnly) {
    this.httpOnly = httpOnly;
    return this;
  }

  public String getSameSite() {
    return sameSite;
  }

  public CookieOptions sameSite(String sameSite) {
    this.sameSite = sameSite;
    return this;
  }

  /**
   * Renders the cookie as a Set-Cookie header value.
   *
   * @param name the cookie name
   * @param value the cookie value
   * @return the header value
   */
  String render(String name, String value) {
    StringBuilder sb = new StringBuilder(name).append('=').append(value);
    if (maxAge != null && maxAge != 0) {
      sb.append("; Max-Age=").append(maxAge);
    }
    if (expires != null) {
      sb.append("; Expires=").append(expires);
    }
    if (path != null) {
      sb.append("; Path=").append(path);
    }
    if (domain != null) {
      sb.append("; Domain=").append(domain);
    }
    if (secure) {
      sb.append("; Secure");
    }
    if (httpOnly) {
      sb.append("; HttpOnly");
    }
    if (sameSite != null) {
      sb.append("; SameSite=").append(sameSite);
    }
    return sb.toString();
  }
}
