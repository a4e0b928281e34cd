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

import org.eventcore.domain.shoppingcart.ShoppingCartCommand.AddProductItem;
import org.eventcore.domain.shoppingcart.ShoppingCartCommand.ApplyDiscount;
import org.eventcore.domain.shoppingcart.ShoppingCartCommand.ConfirmShoppingCart;
import org.eventcore.domain.shoppingcart.ShoppingCartCommand.RemoveProductItem;
import org.eventcore.domain.shoppingcart.ShoppingCartEvent.DiscountApplied;
import org.eventcore.domain.shoppingcart.ShoppingCartEvent.ProductItemAdded;
import org.eventcore.domain.shoppingcart.ShoppingCartEvent.ProductItemRemoved;
import org.eventcore.domain.shoppingcart.ShoppingCartEvent.ShoppingCartConfirmed;
import org.eventcore.dsl.decider.Decider;
import org.eventcore.errors.IllegalDomainStateException;

import java.util.List;

public class ShoppingCartDecider implements Decider<ShoppingCartCommand, ShoppingCart, ShoppingCartEvent> {

    @Override
    public ShoppingCart initialState() {
        return ShoppingCart.initial();
    }

    @Override
    public List<ShoppingCartEvent> decide(ShoppingCartCommand command, ShoppingCart state) {
        if (state.isConfirmed()) {
            throw new IllegalDomainStateException("Shopping cart is already confirmed");
        }

        if (command instanceof AddProductItem c) {
            return List.of(new ProductItemAdded(c.productItem()));
        } else if (command instanceof RemoveProductItem c) {
            return List.of(new ProductItemRemoved(c.productItem(), c.removedBy()));
        } else if (command instanceof ApplyDiscount c) {
            return List.of(new DiscountApplied(c.percent(), c.couponId()));
        } else if (command instanceof ConfirmShoppingCart c) {
            if (state.status() == ShoppingCartStatus.EMPTY) {
                throw new IllegalDomainStateException("Cannot confirm an empty shopping cart");
            }
            return List.of(new ShoppingCartConfirmed(c.now()));
        }
        throw new IllegalArgumentException("Unknown command " + command.getClass().getName());
    }

    @Override
    public ShoppingCart evolve(ShoppingCart state, ShoppingCartEvent event) {
        return ShoppingCart.evolve(state, event);
    }

    @Override
    public boolean isTerminal(ShoppingCart state) {
        return state.isConfirmed();
    }
}
