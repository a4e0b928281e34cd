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

import org.eventcore.message.Command;
import org.jspecify.annotations.Nullable;

import java.time.Instant;

public sealed interface ShoppingCartCommand extends Command {

    record AddProductItem(PricedProductItem productItem) implements ShoppingCartCommand {
    }

    record RemoveProductItem(PricedProductItem productItem, @Nullable String removedBy) implements ShoppingCartCommand {
    }

    record ApplyDiscount(double percent, String couponId) implements ShoppingCartCommand {
    }

    record ConfirmShoppingCart(Instant now) implements ShoppingCartCommand {
    }
}
