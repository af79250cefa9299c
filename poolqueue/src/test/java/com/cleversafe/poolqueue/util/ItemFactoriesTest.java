/*
 * Copyright (C) 2011 the original author or authors. See the notice.md file distributed with this
 * work for additional information regarding copyright ownership.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 */

package com.cleversafe.poolqueue.util;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import org.testng.Assert;
import org.testng.annotations.Test;

public class ItemFactoriesTest {

  @Test
  public void testNoArgConstructor() {
    final Supplier<StringBuilder> factory = ItemFactories.constructing(StringBuilder.class);
    final StringBuilder first = factory.get();
    final StringBuilder second = factory.get();
    Assert.assertNotSame(first, second);
    Assert.assertEquals(first.length(), 0);
  }

  @Test
  public void testPrimitiveParameterAcceptsBoxedArgument() {
    final Supplier<AtomicInteger> factory = ItemFactories.constructing(AtomicInteger.class, 7);
    Assert.assertEquals(factory.get().get(), 7);
  }

  @Test
  public void testNullArgumentMatchesReferenceParameter() {
    final Supplier<Holder> factory = ItemFactories.constructing(Holder.class, (Object) null);
    Assert.assertNull(factory.get().value);
  }

  @Test
  public void testArgumentsCapturedAtCreation() {
    final Object[] args = {"a"};
    final Supplier<Holder> factory = ItemFactories.constructing(Holder.class, args);
    args[0] = "b";
    Assert.assertEquals(factory.get().value, "a");
  }

  @Test
  public void testMostSpecificConstructorChosen() {
    Assert.assertEquals(ItemFactories.constructing(Overloaded.class, "x").get().chosen, "String");
    Assert.assertEquals(ItemFactories.constructing(Overloaded.class, (Object) null).get().chosen,
        "String");
    Assert.assertEquals(
        ItemFactories.constructing(Overloaded.class, new StringBuilder()).get().chosen,
        "CharSequence");
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testAmbiguousConstructorsRejected() {
    ItemFactories.constructing(Overloaded.class, null, null);
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testAbstractType() {
    ItemFactories.constructing(AbstractList.class);
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testNoMatchingConstructor() {
    ItemFactories.constructing(ArrayList.class, "not a capacity");
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testNullForPrimitiveParameter() {
    ItemFactories.constructing(AtomicInteger.class, (Object) null);
  }

  @Test
  public void testConstructorFailurePropagates() {
    final Supplier<Failing> unchecked = ItemFactories.constructing(Failing.class, false);
    try {
      unchecked.get();
      Assert.fail("expected constructor failure");
    } catch (final UnsupportedOperationException expected) {
      Assert.assertEquals(expected.getMessage(), "unchecked");
    }

    final Supplier<Failing> checked = ItemFactories.constructing(Failing.class, true);
    try {
      checked.get();
      Assert.fail("expected constructor failure");
    } catch (final IllegalStateException expected) {
      Assert.assertEquals(expected.getCause().getMessage(), "checked");
    }
  }

  public static final class Holder {
    final String value;

    public Holder(final String value) {
      this.value = value;
    }
  }

  public static final class Overloaded {
    final String chosen;

    public Overloaded(final CharSequence value) {
      this.chosen = "CharSequence";
    }

    public Overloaded(final String value) {
      this.chosen = "String";
    }

    public Overloaded(final String first, final Object second) {
      this.chosen = "String, Object";
    }

    public Overloaded(final Object first, final String second) {
      this.chosen = "Object, String";
    }
  }

  public static final class Failing {
    public Failing(final boolean checked) throws Exception {
      if (checked) {
        throw new Exception("checked");
      }
      throw new UnsupportedOperationException("unchecked");
    }
  }
}
