package com.example.notifier.job.delivery;

import com.example.notifier.job.JobParameterType;
import com.example.notifier.model.NotificationChannel;
import com.example.notifier.service.NotificationDeliveryService;
import org.springframework.stereotype.Component;

@Component
public class EmailNotifierTemplate extends AbstractChannelNotifierTemplate {

  public static final String TEMPLATE_TYPE = "email_notifier";

  public EmailNotifierTemplate(NotificationDeliveryService deliveryService) {
    super(deliveryService);
  }

  @Override
  public String templateType() {
    return TEMPLATE_TYPE;
  }

  @Override
  public String name() {
    return "Email notifier";
  }

  @Override
  public String description() {
    return "Delivers pending email notifications from the queue";
  }

  @Override
  protected NotificationChannel channel() {
    return NotificationChannel.EMAIL;
  }

  @Override
  protected JobParameterType recipientType() {
    return JobParameterType.EMAIL;
  }
}
