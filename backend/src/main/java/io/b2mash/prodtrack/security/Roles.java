package io.b2mash.prodtrack.security;

/**
 * Role constants. Token roles arrive in the JWT {@code role} claim; Spring authorities are the
 * {@code ROLE_} prefixed versions used by {@code @PreAuthorize}.
 */
public final class Roles {

  public static final String ADMIN = "admin";
  public static final String MANAGER = "manager";
  public static final String USER = "user";

  public static final String AUTHORITY_ADMIN = "ROLE_ADMIN";
  public static final String AUTHORITY_MANAGER = "ROLE_MANAGER";
  public static final String AUTHORITY_USER = "ROLE_USER";

  private Roles() {}
}
