package com.trellis.http;

/**
 * An exception that carries the HTTP status it should be answered with.
 *
 * <p>Statuses below 500 expose their message to the client by default; server errors do not.
 */
public class HttpException extends RuntimeException {
  private final int status;
  private final boolean expose;

  public HttpException(int status, String message) {
    this(status, message, status < 500);
  }

  public HttpException(int status, String message, boolean expose) {
    super(message);
    this.status = status;
    this.expose = expose;
  }

  public HttpException(int status, String message, Throwable cause) {
    super(message, cause);
    this.status = status;
    this.expose = status < 500;
  }

  public int getStatus() {
    return status;
  }

  /**
   * Whether the message may be shown to the client.
   *
   * @return true if the message is safe to expose
   */
  public boolean isExpose() {
    return expose;
  }

  public static HttpException badRequest(String message) {
    return new HttpException(400, message);
  }

  public static HttpException unauthorized(String message) {
    return new HttpException(401, message);
  }

  public static HttpException forbidden(String message) {
    return new HttpException(403, message);
  }

  public static HttpException notFound(String message) {
    return new HttpException(404, message);
  }

  public static HttpException conflict(String message) {
    return new HttpException(409, message);
  }

  /**
   * Gets the standard reason phrase for a status code.
   *
   * @param status the status code
   * @return the reason phrase, or "Unknown Status"
   */
  public static String reasonPhrase(int status) {
    switch (status) {
      case 400:
        return "Bad Request";
      case 401:
        return "Unauthorized";
      case 403:
        return "Forbidden";
      case 404:
        return "Not Found";
      case 405:
        return "Method Not Allowed";
      case 409:
        return "Conflict";
      case 422:
        return "Unprocessable Entity";
      case 429:
        return "Too Many Requests";
      case 500:
        return "Internal Server Error";
      case 501:
        return "Not Implemented";
      case 502:
        return "Bad Gateway";
      case 503:
        return "Service Unavailable";
      default:
        return "Unknown Status";
    }
  }
}
