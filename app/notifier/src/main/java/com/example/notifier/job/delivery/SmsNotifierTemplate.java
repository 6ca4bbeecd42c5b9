package com.example.notifier.job.delivery;

import com.example.notifier.job.JobParameterType;
import com.example.notifier.model.NotificationChannel;
import com.example.notifier.service.NotificationDeliveryService;
import org.springframework.stereotype.Component;

@Component
public class SmsNotifierTemplate extends AbstractChannelNotifierTemplate {

  public static final String TEMPLATE_TYPE = "sms_notifier";

  public SmsNotifierTemplate(NotificationDeliveryService deliveryService) {
    super(deliveryService);
  }

  @Override
  public String templateType() {
    return TEMPLATE_TYPE;
  }

  @Override
  public String name() {
    return "SMS notifier";
  }

  @Override
  public String description() {
    return "Delivers pending SMS notifications from the queue";
  }

  @Override
  protected NotificationChannel channel() {
    return NotificationChannel.SMS;
  }

  @Override
  protected JobParameterType recipientType() {
    return JobParameterType.STRING;
  }
}
