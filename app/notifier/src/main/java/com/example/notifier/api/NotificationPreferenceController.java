package com.example.notifier.api;

import com.example.notifier.api.request.TriggerPreferenceRequest;
import com.example.notifier.api.response.NotificationPreferencesResponse;
import com.example.notifier.model.NotificationTrigger;
import com.example.notifier.service.NotificationPreferenceService;
import jakarta.validation.Valid;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/notification-preferences")
@RequiredArgsConstructor
public class NotificationPreferenceController {

  private final NotificationPreferenceService preferenceService;

  @GetMapping("/{username}")
  public NotificationPreferencesResponse get(@PathVariable("username") String username) {
    return NotificationPreferencesResponse.from(preferenceService.get(username));
  }

  @PutMapping("/{username}/triggers/{trigger}")
  public NotificationPreferencesResponse updateTrigger(
      @PathVariable("username") String username,
      @PathVariable("trigger") String trigger,
      @Valid @RequestBody TriggerPreferenceRequest request) {
    return NotificationPreferencesResponse.from(
        preferenceService.updateTrigger(username, request.toPreference(parseTrigger(trigger))));
  }

  private NotificationTrigger parseTrigger(String value) {
    try {
      return NotificationTrigger.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("unknown trigger: " + value, ex);
    }
  }
}
