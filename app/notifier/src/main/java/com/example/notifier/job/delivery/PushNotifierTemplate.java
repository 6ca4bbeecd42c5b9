package com.example.notifier.job.delivery;

import com.example.notifier.job.JobParameterType;
import com.example.notifier.model.NotificationChannel;
import com.example.notifier.service.NotificationDeliveryService;
import org.springframework.stereotype.Component;

@Component
public class PushNotifierTemplate extends AbstractChannelNotifierTemplate {

  public static final String TEMPLATE_TYPE = "push_notifier";

  public PushNotifierTemplate(NotificationDeliveryService deliveryService) {
    super(deliveryService);
  }

  @Override
  public String templateType() {
    return TEMPLATE_TYPE;
  }

  @Override
  public String name() {
    return "Push notifier";
  }

  @Override
  public String description() {
    return "Delivers pending push notifications from the queue";
  }

  @Override
  protected NotificationChannel channel() {
    return NotificationChannel.PUSH;
  }

  @Override
  protected JobParameterType recipientType() {
    return JobParameterType.STRING;
  }
}
