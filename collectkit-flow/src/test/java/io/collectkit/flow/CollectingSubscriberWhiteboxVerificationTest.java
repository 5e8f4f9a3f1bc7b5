/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: collectkit
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package io.collectkit.flow;

import java.util.concurrent.Flow.Subscriber;
import java.util.concurrent.Flow.Subscription;

import org.reactivestreams.tck.TestEnvironment;
import org.reactivestreams.tck.flow.FlowSubscriberWhiteboxVerification;

public class CollectingSubscriberWhiteboxVerificationTest
    extends FlowSubscriberWhiteboxVerification<Integer> {

  public CollectingSubscriberWhiteboxVerificationTest() {
    super(new TestEnvironment());
  }

  @Override
  protected Subscriber<Integer> createFlowSubscriber(
      final WhiteboxSubscriberProbe<Integer> observer) {
    return new CollectingSubscriber<Integer>(1) {
      private boolean subscribed;

      @Override
      public void onSubscribe(final Subscription subscription) {
        super.onSubscribe(subscription);
        if (this.subscribed) {
          // a second subscription is cancelled, the puppet stays on the first
          return;
        }
        this.subscribed = true;
        observer.registerOnSubscribe(new SubscriberPuppet() {
          @Override
          public void triggerRequest(final long elements) {
            subscription.request(elements);
          }

          @Override
          public void signalCancel() {
            subscription.cancel();
          }
        });
      }

      @Override
      public void onNext(final Integer item) {
        super.onNext(item);
        observer.registerOnNext(item);
      }

      @Override
      public void onError(final Throwable throwable) {
        super.onError(throwable);
        observer.registerOnError(throwable);
      }

      @Override
      public void onComplete() {
        super.onComplete();
        observer.registerOnComplete();
      }
    };
  }

  @Override
  public Integer createElement(final int element) {
    return element;
  }
}
