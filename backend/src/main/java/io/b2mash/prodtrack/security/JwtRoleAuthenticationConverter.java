package io.b2mash.prodtrack.security;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

@Component
public class JwtRoleAuthenticationConverter
    implements Converter<Jwt, AbstractAuthenticationToken> {

  private static final Map<String, String> ROLE_MAPPING =
      Map.of(
          Roles.ADMIN, Roles.AUTHORITY_ADMIN,
          Roles.MANAGER, Roles.AUTHORITY_MANAGER,
          Roles.USER, Roles.AUTHORITY_USER);

  @Override
  public AbstractAuthenticationToken convert(Jwt jwt) {
    Collection<GrantedAuthority> authorities = extractAuthorities(jwt);
    return new JwtAuthenticationToken(jwt, authorities, jwt.getSubject());
  }

  /** Accepts a single {@code role} string or a {@code roles} list; unknown roles are dropped. */
  private Collection<GrantedAuthority> extractAuthorities(Jwt jwt) {
    var roles = new ArrayList<String>();
    String role = jwt.getClaimAsString("role");
    if (role != null) {
      roles.add(role);
    }
    List<String> roleList = jwt.getClaimAsStringList("roles");
    if (roleList != null) {
      roles.addAll(roleList);
    }

    return roles.stream()
        .map(r -> ROLE_MAPPING.get(r.toLowerCase(Locale.ROOT)))
        .filter(authority -> authority != null)
        .distinct()
        .map(authority -> (GrantedAuthority) new SimpleGrantedAuthority(authority))
        .toList();
  }
}
