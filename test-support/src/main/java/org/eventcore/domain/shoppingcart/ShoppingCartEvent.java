/*
 * Copyright 2026 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.eventcore.domain.shoppingcart;

import org.eventcore.message.Event;
import org.jspecify.annotations.Nullable;

import java.time.Instant;

public sealed interface ShoppingCartEvent extends Event {

    record ProductItemAdded(PricedProductItem productItem) implements ShoppingCartEvent {
    }

    /**
     * @param removedBy {@code null} when the item was removed by the system (out of stock, expired)
     */
    record ProductItemRemoved(PricedProductItem productItem, @Nullable String removedBy) implements ShoppingCartEvent {
    }

    record DiscountApplied(double percent, String couponId) implements ShoppingCartEvent {
    }

    record ShoppingCartConfirmed(Instant confirmedAt) implements ShoppingCartEvent {
    }
}
