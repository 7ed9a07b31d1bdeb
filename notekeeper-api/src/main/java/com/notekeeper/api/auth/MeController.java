package com.notekeeper.api.auth;

import com.notekeeper.api.security.CurrentUser;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/auth")
public class MeController {

  /**
   * Returns the profile of the user the bearer token resolved to. Never includes the password hash.
   */
  @GetMapping("/me")
  public AuthController.UserResponse me(@AuthenticationPrincipal CurrentUser user) {
    return AuthController.UserResponse.of(user);
  }
}
